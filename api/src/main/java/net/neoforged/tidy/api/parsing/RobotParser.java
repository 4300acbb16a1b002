package net.neoforged.tidy.api.parsing;

import net.neoforged.tidy.api.model.Block;
import net.neoforged.tidy.api.model.Section;
import net.neoforged.tidy.api.model.SectionType;
import net.neoforged.tidy.api.model.SourceTree;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.StatementType;
import net.neoforged.tidy.api.model.Token;
import net.neoforged.tidy.api.model.TokenType;
import net.neoforged.tidy.api.variables.VariableSearcher;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses Robot Framework data in the space separated format into a {@link SourceTree}.
 * <p>
 * Every character of the input ends up in exactly one token, so concatenating all tokens in order gives back the
 * input. The parser never fails: lines it does not understand become {@link StatementType#ERROR} statements.
 */
public final class RobotParser {
    /**
     * Two or more spaces, or any run of whitespace containing a tab.
     */
    private static final Pattern SEPARATOR = Pattern.compile("[ \\t]*(?:\\t| {2})[ \\t]*");
    private static final Pattern BLOCK_SETTING = Pattern.compile("\\[\\s*(.*?)\\s*]");
    private static final Pattern VAR_OPTION = Pattern.compile("(?i)(scope|separator)=.*");
    private static final String CONTINUATION = "...";

    private static final Map<String, TokenType> SUITE_SETTINGS = Map.ofEntries(
            Map.entry("documentation", TokenType.DOCUMENTATION),
            Map.entry("name", TokenType.SUITE_NAME),
            Map.entry("metadata", TokenType.METADATA),
            Map.entry("suite setup", TokenType.SUITE_SETUP),
            Map.entry("suite teardown", TokenType.SUITE_TEARDOWN),
            Map.entry("test setup", TokenType.TEST_SETUP),
            Map.entry("task setup", TokenType.TEST_SETUP),
            Map.entry("test teardown", TokenType.TEST_TEARDOWN),
            Map.entry("task teardown", TokenType.TEST_TEARDOWN),
            Map.entry("test template", TokenType.TEST_TEMPLATE),
            Map.entry("task template", TokenType.TEST_TEMPLATE),
            Map.entry("test timeout", TokenType.TEST_TIMEOUT),
            Map.entry("task timeout", TokenType.TEST_TIMEOUT),
            Map.entry("force tags", TokenType.TEST_TAGS),
            Map.entry("test tags", TokenType.TEST_TAGS),
            Map.entry("task tags", TokenType.TEST_TAGS),
            Map.entry("default tags", TokenType.DEFAULT_TAGS),
            Map.entry("keyword tags", TokenType.KEYWORD_TAGS),
            Map.entry("library", TokenType.LIBRARY),
            Map.entry("resource", TokenType.RESOURCE),
            Map.entry("variables", TokenType.VARIABLES)
    );

    private static final Map<String, TokenType> BLOCK_SETTINGS = Map.of(
            "documentation", TokenType.DOCUMENTATION,
            "tags", TokenType.TAGS,
            "setup", TokenType.SETUP,
            "teardown", TokenType.TEARDOWN,
            "template", TokenType.TEMPLATE,
            "timeout", TokenType.TIMEOUT,
            "arguments", TokenType.ARGUMENTS,
            "return", TokenType.RETURN_SETTING
    );

    private static final Map<String, StatementType> CONTROL_STATEMENTS = Map.ofEntries(
            Map.entry("END", StatementType.END),
            Map.entry("IF", StatementType.IF_HEADER),
            Map.entry("ELSE IF", StatementType.ELSE_IF_HEADER),
            Map.entry("ELSE", StatementType.ELSE_HEADER),
            Map.entry("WHILE", StatementType.WHILE_HEADER),
            Map.entry("TRY", StatementType.TRY_HEADER),
            Map.entry("EXCEPT", StatementType.EXCEPT_HEADER),
            Map.entry("FINALLY", StatementType.FINALLY_HEADER),
            Map.entry("RETURN", StatementType.RETURN),
            Map.entry("BREAK", StatementType.BREAK),
            Map.entry("CONTINUE", StatementType.CONTINUE)
    );

    private static final Map<String, TokenType> CONTROL_TOKENS = Map.ofEntries(
            Map.entry("END", TokenType.END),
            Map.entry("IF", TokenType.IF),
            Map.entry("ELSE IF", TokenType.ELSE_IF),
            Map.entry("ELSE", TokenType.ELSE),
            Map.entry("WHILE", TokenType.WHILE),
            Map.entry("TRY", TokenType.TRY),
            Map.entry("EXCEPT", TokenType.EXCEPT),
            Map.entry("FINALLY", TokenType.FINALLY),
            Map.entry("RETURN", TokenType.RETURN_STATEMENT),
            Map.entry("BREAK", TokenType.BREAK),
            Map.entry("CONTINUE", TokenType.CONTINUE)
    );

    private static final List<String> FOR_SEPARATORS = List.of("IN", "IN RANGE", "IN ENUMERATE", "IN ZIP");

    private RobotParser() {
    }

    public static SourceTree parse(String text) {
        var lines = lexLines(text);
        var builder = new TreeBuilder();
        for (var group : groupStatements(lines)) {
            builder.accept(group);
        }
        var sections = builder.finish();
        markTemplatedBlocks(sections);
        return new SourceTree(sections, detectLineSeparator(text));
    }

    private static @Nullable String detectLineSeparator(String text) {
        int index = text.indexOf('\n');
        if (index < 0) {
            return null;
        }
        return index > 0 && text.charAt(index - 1) == '\r' ? "\r\n" : "\n";
    }

    private static List<List<Token>> lexLines(String text) {
        var lines = new ArrayList<List<Token>>();
        int lineNumber = 1;
        int pos = 0;
        while (pos < text.length()) {
            int newline = text.indexOf('\n', pos);
            int next = newline < 0 ? text.length() : newline + 1;
            int contentEnd = newline < 0 ? text.length() : newline;
            if (contentEnd > pos && text.charAt(contentEnd - 1) == '\r') {
                contentEnd--;
            }
            lines.add(lexLine(lineNumber++, text.substring(pos, contentEnd), text.substring(contentEnd, next)));
            pos = next;
        }
        return lines;
    }

    private static List<Token> lexLine(int lineNumber, String content, String terminator) {
        var tokens = new ArrayList<Token>();
        int dataEnd = content.length();
        while (dataEnd > 0 && isWhitespace(content.charAt(dataEnd - 1))) {
            dataEnd--;
        }
        if (dataEnd == 0) {
            tokens.add(new Token(TokenType.EOL, content + terminator, lineNumber, 0));
            return tokens;
        }

        int pos = 0;
        while (pos < dataEnd && isWhitespace(content.charAt(pos))) {
            pos++;
        }
        if (pos > 0) {
            tokens.add(new Token(TokenType.SEPARATOR, content.substring(0, pos), lineNumber, 0));
        }
        var matcher = SEPARATOR.matcher(content);
        boolean first = true;
        while (pos < dataEnd) {
            if (content.charAt(pos) == '#') {
                tokens.add(new Token(TokenType.COMMENT, content.substring(pos, dataEnd), lineNumber, pos));
                break;
            }
            matcher.region(pos, dataEnd);
            int cellEnd = matcher.find() ? matcher.start() : dataEnd;
            var cell = content.substring(pos, cellEnd);
            var type = first && cell.equals(CONTINUATION) ? TokenType.CONTINUATION : TokenType.ARGUMENT;
            tokens.add(new Token(type, cell, lineNumber, pos));
            first = false;
            if (cellEnd == dataEnd) {
                break;
            }
            tokens.add(new Token(TokenType.SEPARATOR, matcher.group(), lineNumber, cellEnd));
            pos = matcher.end();
        }
        tokens.add(new Token(TokenType.EOL, content.substring(dataEnd) + terminator, lineNumber, dataEnd));
        return tokens;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t';
    }

    /**
     * Joins lines starting with {@code ...} to the statement above them.
     */
    private static List<List<Token>> groupStatements(List<List<Token>> lines) {
        var groups = new ArrayList<List<Token>>();
        boolean acceptsContinuation = false;
        for (var line : lines) {
            var first = firstNonSeparator(line);
            if (first != null && first.type() == TokenType.CONTINUATION && acceptsContinuation) {
                groups.get(groups.size() - 1).addAll(line);
                continue;
            }
            groups.add(new ArrayList<>(line));
            acceptsContinuation = first != null && first.type() == TokenType.ARGUMENT && !isHeader(first);
        }
        return groups;
    }

    private static @Nullable Token firstNonSeparator(List<Token> tokens) {
        for (var token : tokens) {
            if (token.type() != TokenType.SEPARATOR) {
                return token.type() == TokenType.EOL ? null : token;
            }
        }
        return null;
    }

    private static boolean isHeader(Token token) {
        return token.columnOffset() == 0 && token.value().startsWith("*");
    }

    private static final class TreeBuilder {
        private final List<Section> sections = new ArrayList<>();
        private SectionType sectionType = SectionType.COMMENTS;
        @Nullable
        private Statement sectionHeader;
        private List<Statement> sectionBody = new ArrayList<>();
        private List<Block> blocks = new ArrayList<>();
        @Nullable
        private Statement blockHeader;
        private List<Statement> blockBody = new ArrayList<>();

        void accept(List<Token> tokens) {
            var first = firstNonSeparator(tokens);
            if (first != null && first.type() == TokenType.ARGUMENT && isHeader(first)) {
                finishSection();
                sectionType = SectionType.fromHeader(first.value());
                sectionHeader = new Statement(StatementType.SECTION_HEADER, retype(tokens, first, sectionType.headerType()));
                return;
            }

            if (!sectionType.hasBlocks()) {
                sectionBody.add(classifySectionStatement(tokens, sectionType));
                return;
            }

            if (first != null && first.type() == TokenType.ARGUMENT && first.columnOffset() == 0) {
                finishBlock();
                startBlock(tokens, first);
                return;
            }

            var statement = classifyBodyStatement(tokens);
            if (blockHeader != null) {
                blockBody.add(statement);
            } else {
                sectionBody.add(statement);
            }
        }

        private void startBlock(List<Token> tokens, Token name) {
            var nameType = sectionType == SectionType.KEYWORDS ? TokenType.KEYWORD_NAME : TokenType.TESTCASE_NAME;
            var statementType = sectionType == SectionType.KEYWORDS ? StatementType.KEYWORD_NAME : StatementType.TESTCASE_NAME;
            int nameIndex = tokens.indexOf(name);
            int restIndex = -1;
            for (int i = nameIndex + 1; i < tokens.size(); i++) {
                if (tokens.get(i).type().isData()) {
                    // the separator in front of the first data cell starts the body statement
                    restIndex = i - 1;
                    break;
                }
            }
            if (restIndex < 0) {
                blockHeader = new Statement(statementType, retype(tokens, name, nameType));
                return;
            }
            blockHeader = new Statement(statementType, retype(tokens.subList(0, restIndex), name, nameType));
            blockBody.add(classifyBodyStatement(new ArrayList<>(tokens.subList(restIndex, tokens.size()))));
        }

        private void finishBlock() {
            if (blockHeader != null) {
                blocks.add(new Block(sectionType.blockType(), blockHeader, blockBody));
            }
            blockHeader = null;
            blockBody = new ArrayList<>();
        }

        private void finishSection() {
            finishBlock();
            if (sectionHeader != null || !sectionBody.isEmpty() || !blocks.isEmpty()) {
                sections.add(new Section(sectionType, sectionHeader, sectionBody, blocks));
            }
            sectionHeader = null;
            sectionBody = new ArrayList<>();
            blocks = new ArrayList<>();
        }

        List<Section> finish() {
            finishSection();
            return sections;
        }
    }

    private static List<Token> retype(List<Token> tokens, Token target, TokenType type) {
        var result = new ArrayList<Token>(tokens.size());
        for (var token : tokens) {
            result.add(token == target ? token.withType(type) : token);
        }
        return result;
    }

    /**
     * Statement skeleton shared by the classifiers: the tokens and the positions of the data cells in them.
     */
    private static final class Cells {
        final List<Token> tokens;
        final List<Integer> data = new ArrayList<>();

        Cells(List<Token> tokens) {
            this.tokens = new ArrayList<>(tokens);
            for (int i = 0; i < this.tokens.size(); i++) {
                if (this.tokens.get(i).type() == TokenType.ARGUMENT) {
                    data.add(i);
                }
            }
        }

        int size() {
            return data.size();
        }

        String value(int cell) {
            return tokens.get(data.get(cell)).value();
        }

        void type(int cell, TokenType type) {
            int index = data.get(cell);
            tokens.set(index, tokens.get(index).withType(type));
        }

        void typeFrom(int cell, TokenType type) {
            for (int i = cell; i < data.size(); i++) {
                type(i, type);
            }
        }

        boolean startsWithContinuation() {
            var first = firstNonSeparator(tokens);
            return first != null && first.type() == TokenType.CONTINUATION;
        }

        boolean hasComment() {
            for (var token : tokens) {
                if (token.type() == TokenType.COMMENT) {
                    return true;
                }
            }
            return false;
        }

        Statement build(StatementType type) {
            return new Statement(type, tokens);
        }
    }

    private static @Nullable Statement classifyTrivial(Cells cells) {
        if (cells.size() == 0) {
            return cells.build(cells.hasComment() ? StatementType.COMMENT : StatementType.EMPTY_LINE);
        }
        if (cells.startsWithContinuation()) {
            cells.typeFrom(0, TokenType.ERROR);
            return cells.build(StatementType.ERROR);
        }
        return null;
    }

    private static Statement classifySectionStatement(List<Token> tokens, SectionType section) {
        var cells = new Cells(tokens);
        var trivial = classifyTrivial(cells);
        if (trivial != null) {
            return trivial;
        }
        return switch (section) {
            case SETTINGS -> classifySuiteSetting(cells);
            case VARIABLES -> {
                cells.type(0, TokenType.VARIABLE);
                yield cells.build(StatementType.VARIABLE);
            }
            case COMMENTS -> {
                cells.typeFrom(0, TokenType.COMMENT);
                yield cells.build(StatementType.COMMENT);
            }
            default -> {
                cells.typeFrom(0, TokenType.ERROR);
                yield cells.build(StatementType.ERROR);
            }
        };
    }

    private static Statement classifySuiteSetting(Cells cells) {
        var name = cells.value(0).trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        var setting = SUITE_SETTINGS.get(name);
        if (setting == null) {
            cells.typeFrom(0, TokenType.ERROR);
            return cells.build(StatementType.ERROR);
        }
        cells.type(0, setting);
        switch (setting) {
            case LIBRARY -> {
                for (int i = 1; i < cells.size(); i++) {
                    var value = cells.value(i);
                    if (i == 1) {
                        cells.type(i, TokenType.NAME);
                    } else if ((value.equals("AS") || value.equals("WITH NAME")) && i + 1 < cells.size()) {
                        cells.type(i, TokenType.WITH_NAME);
                        cells.type(i + 1, TokenType.NAME);
                        i++;
                    }
                }
            }
            case RESOURCE, VARIABLES, SUITE_SETUP, SUITE_TEARDOWN, TEST_SETUP, TEST_TEARDOWN, TEST_TEMPLATE -> {
                if (cells.size() > 1) {
                    cells.type(1, TokenType.NAME);
                }
            }
            default -> {
            }
        }
        return cells.build(StatementType.SUITE_SETTING);
    }

    private static Statement classifyBodyStatement(List<Token> tokens) {
        var cells = new Cells(tokens);
        var trivial = classifyTrivial(cells);
        if (trivial != null) {
            return trivial;
        }
        var first = cells.value(0);

        var setting = BLOCK_SETTING.matcher(first);
        if (setting.matches()) {
            var type = BLOCK_SETTINGS.get(setting.group(1).replace(" ", "").toLowerCase(Locale.ROOT));
            if (type == null) {
                cells.typeFrom(0, TokenType.ERROR);
                return cells.build(StatementType.ERROR);
            }
            cells.type(0, type);
            if ((type == TokenType.SETUP || type == TokenType.TEARDOWN || type == TokenType.TEMPLATE) && cells.size() > 1) {
                cells.type(1, TokenType.NAME);
            }
            return cells.build(StatementType.BLOCK_SETTING);
        }

        if (first.equals("FOR")) {
            cells.type(0, TokenType.FOR);
            boolean inValues = false;
            for (int i = 1; i < cells.size(); i++) {
                if (!inValues && FOR_SEPARATORS.contains(cells.value(i))) {
                    cells.type(i, TokenType.FOR_SEPARATOR);
                    inValues = true;
                } else if (!inValues) {
                    cells.type(i, TokenType.VARIABLE);
                }
            }
            return cells.build(StatementType.FOR_HEADER);
        }

        var control = CONTROL_STATEMENTS.get(first);
        if (control != null) {
            cells.type(0, CONTROL_TOKENS.get(first));
            return cells.build(control);
        }

        if (first.equals("VAR")) {
            cells.type(0, TokenType.VAR);
            if (cells.size() > 1) {
                cells.type(1, TokenType.VARIABLE);
            }
            for (int i = 2; i < cells.size(); i++) {
                if (VAR_OPTION.matcher(cells.value(i)).matches()) {
                    cells.type(i, TokenType.OPTION);
                }
            }
            return cells.build(StatementType.VAR);
        }

        int index = 0;
        while (index < cells.size() && VariableSearcher.isAssign(cells.value(index))) {
            cells.type(index, TokenType.ASSIGN);
            index++;
            if (cells.value(index - 1).endsWith("=")) {
                break;
            }
        }
        if (index < cells.size()) {
            cells.type(index, TokenType.KEYWORD);
        }
        return cells.build(StatementType.KEYWORD_CALL);
    }

    /**
     * Statements in the body of a templated test are arguments for the template, not keyword calls.
     */
    private static void markTemplatedBlocks(List<Section> sections) {
        String suiteTemplate = null;
        for (var section : sections) {
            if (section.type() != SectionType.SETTINGS) {
                continue;
            }
            for (var statement : section.body()) {
                if (statement.getToken(TokenType.TEST_TEMPLATE) != null) {
                    suiteTemplate = statement.getValue(TokenType.NAME);
                }
            }
        }

        for (var section : sections) {
            if (section.type() != SectionType.TEST_CASES && section.type() != SectionType.TASKS) {
                continue;
            }
            for (var block : section.blocks()) {
                if (!isTemplated(block, suiteTemplate)) {
                    continue;
                }
                var body = block.body();
                for (int i = 0; i < body.size(); i++) {
                    var statement = body.get(i);
                    if (statement.type() != StatementType.KEYWORD_CALL) {
                        continue;
                    }
                    var tokens = new ArrayList<Token>();
                    for (var token : statement.tokens()) {
                        var type = token.type();
                        tokens.add(type == TokenType.ASSIGN || type == TokenType.KEYWORD ? token.withType(TokenType.ARGUMENT) : token);
                    }
                    body.set(i, new Statement(StatementType.TEMPLATE_ARGUMENTS, tokens));
                }
            }
        }
    }

    private static boolean isTemplated(Block block, @Nullable String suiteTemplate) {
        for (var statement : block.body()) {
            if (statement.getToken(TokenType.TEMPLATE) != null) {
                var name = statement.getValue(TokenType.NAME);
                return name != null && !name.equalsIgnoreCase("NONE");
            }
        }
        return suiteTemplate != null && !suiteTemplate.equalsIgnoreCase("NONE");
    }
}
