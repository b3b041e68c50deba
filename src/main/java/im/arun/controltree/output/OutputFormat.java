package im.arun.controltree.output;

public enum OutputFormat {
    YAML,
    JSON
}
