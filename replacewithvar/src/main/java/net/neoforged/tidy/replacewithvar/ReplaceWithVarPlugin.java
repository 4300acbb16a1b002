package net.neoforged.tidy.replacewithvar;

import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.SourceTransformerPlugin;
import net.neoforged.tidy.api.TransformerId;

public class ReplaceWithVarPlugin implements SourceTransformerPlugin {
    @Override
    public TransformerId getId() {
        return TransformerId.REPLACE_WITH_VAR;
    }

    @Override
    public String getDescription() {
        return "Replaces Set Variable, Catenate, Create List, Create Dictionary and the Set ... Variable keywords with VAR.";
    }

    @Override
    public SourceTransformer createTransformer() {
        return new ReplaceWithVarTransformer();
    }
}
