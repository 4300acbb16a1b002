package net.neoforged.tidy.splittoolongline;

import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.SourceTransformerPlugin;
import net.neoforged.tidy.api.TransformerId;

public class SplitTooLongLinePlugin implements SourceTransformerPlugin {
    @Override
    public TransformerId getId() {
        return TransformerId.SPLIT_TOO_LONG_LINE;
    }

    @Override
    public String getDescription() {
        return "Splits keyword calls, VAR statements and variables longer than the line length over several lines.";
    }

    @Override
    public SourceTransformer createTransformer() {
        return new SplitTooLongLineTransformer();
    }
}
