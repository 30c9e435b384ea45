package cmdtree.cli.option;

import java.util.Locale;

public enum ArgumentKind {
    STRING,
    INT,
    DOUBLE,
    PATH;

    public String placeholder() {
        return name().toLowerCase(Locale.ROOT);
    }
}
