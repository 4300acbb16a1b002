package net.neoforged.tidy.renamevariables;

import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.SourceTransformerPlugin;
import net.neoforged.tidy.api.TransformerId;

public class RenameVariablesPlugin implements SourceTransformerPlugin {
    @Override
    public TransformerId getId() {
        return TransformerId.RENAME_VARIABLES;
    }

    @Override
    public String getDescription() {
        return "Normalizes variable names: upper case for suite level variables, lower case for local ones, words separated by underscores.";
    }

    @Override
    public SourceTransformer createTransformer() {
        return new RenameVariablesTransformer();
    }
}
