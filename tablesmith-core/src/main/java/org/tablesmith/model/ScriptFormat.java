package org.tablesmith.model;

import lombok.Builder;
import lombok.Getter;
import org.tablesmith.options.TablesmithOptions;

/**
 * Layout settings shared by every generator of a run.
 */
@Getter
@Builder
public class ScriptFormat {
    @Builder.Default private final int indentSize = TablesmithOptions.Format.INDENT_SIZE_DEFAULT;
    @Builder.Default private final int columnPadWidth = TablesmithOptions.Format.COLUMN_PAD_WIDTH;
    @Builder.Default private final boolean includeTimestamps = TablesmithOptions.Format.INCLUDE_TIMESTAMPS_DEFAULT;

    public static ScriptFormat defaults() {
        return ScriptFormat.builder().build();
    }

    public String indent() {
        return " ".repeat(Math.max(0, indentSize));
    }

    public String indent(int levels) {
        return indent().repeat(Math.max(0, levels));
    }
}
