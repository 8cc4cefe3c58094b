package com.libragraph.registry.types;

/**
 * Kinds of versioned configuration assets the registry manages.
 * The label doubles as the top-level directory in content-addressable storage.
 */
public enum AssetType {
    FRAMEWORK(0, "framework", "framework"),
    PROMPT_TEMPLATE(1, "prompt_template", "template"),
    WEIGHTING_SCHEME(2, "weighting_scheme", "scheme"),
    EVALUATOR_CONFIG(3, "evaluator_config", "evaluator"),
    EXPERIMENT(4, "experiment", "experiment");

    private final int id;
    private final String label;
    private final String fileStem;

    AssetType(int id, String label, String fileStem) {
        this.id = id;
        this.label = label;
        this.fileStem = fileStem;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** Base name of the definition file in a development workspace, e.g. {@code framework.yaml}. */
    public String fileStem() {
        return fileStem;
    }

    public static AssetType fromId(int id) {
        for (AssetType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown AssetType id: " + id);
    }

    public static AssetType fromLabel(String label) {
        for (AssetType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("Unknown AssetType label: " + label);
    }
}
