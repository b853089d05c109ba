package ai.docsite.autodoc.cli;

import ai.docsite.autodoc.task.ActionKind;
import picocli.CommandLine;

public class ActionKindConverter implements CommandLine.ITypeConverter<ActionKind> {

    @Override
    public ActionKind convert(String value) {
        return ActionKind.from(value);
    }
}
