package io.eligian.core.parse;

import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.AssetImport;
import io.eligian.core.ast.BreakStatement;
import io.eligian.core.ast.ContinueStatement;
import io.eligian.core.ast.Document;
import io.eligian.core.ast.Expression;
import io.eligian.core.ast.ForStatement;
import io.eligian.core.ast.IfStatement;
import io.eligian.core.ast.Library;
import io.eligian.core.ast.LibraryImport;
import io.eligian.core.ast.Literal;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Parameter;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.Reference;
import io.eligian.core.ast.SourceLocation;
import io.eligian.core.ast.Statement;
import io.eligian.core.ast.Timeline;
import io.eligian.core.ast.TimelineEvent;
import io.eligian.core.ast.VariableDeclaration;
import io.eligian.core.error.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Eligian programs and libraries. Stateless; each call to {@link
 * #parse(String, String)} works on its own token stream.
 *
 * <p>The first syntax error aborts the parse with a {@link ParseException} that carries the exact
 * line and column of the offending token.
 */
public final class SourceParser {

    private static final Set<String> RESERVED = Set.of(
            "action", "break", "const", "continue", "else", "endable", "for", "if", "import", "library",
            "private", "timeline");

    /**
     * Parses a source document.
     *
     * @param source the document text
     * @param uri the document URI, recorded in every location; may be {@code null}
     * @return a {@link Program} or, when the text starts with {@code library}, a {@link Library}
     * @throws ParseException on the first lexical or syntax error
     */
    public Document parse(String source, String uri) {
        List<Token> tokens = new Lexer(source, uri).tokenize();
        return new Cursor(tokens, uri).document();
    }

    /** Parser state over one token list. */
    private static final class Cursor {

        private final List<Token> tokens;
        private final String file;
        private int index;

        Cursor(List<Token> tokens, String file) {
            this.tokens = tokens;
            this.file = file;
        }

        Document document() {
            if (peek().isKeyword("library")) {
                return library();
            }
            return program();
        }

        // --- Documents ---

        private Program program() {
            SourceLocation start = peek().location(file);
            List<AssetImport> assets = new ArrayList<>();
            List<LibraryImport> imports = new ArrayList<>();
            List<VariableDeclaration> constants = new ArrayList<>();
            List<ActionDefinition> actions = new ArrayList<>();
            List<Timeline> timelines = new ArrayList<>();

            while (!peek().is(TokenType.EOF)) {
                Token t = peek();
                if (t.isKeyword("styles") || t.isKeyword("layout") || t.isKeyword("provider")) {
                    assets.add(assetImport());
                } else if (t.isKeyword("import")) {
                    if (peek(1).is(TokenType.LBRACE)) {
                        imports.add(libraryImport());
                    } else {
                        assets.add(namedImport());
                    }
                } else if (t.isKeyword("const")) {
                    constants.add(constDeclaration());
                } else if (t.isKeyword("action") || t.isKeyword("private") || t.isKeyword("endable")) {
                    actions.add(action());
                } else if (t.isKeyword("timeline")) {
                    timelines.add(timeline());
                } else if (t.isKeyword("library")) {
                    throw error(t, "'library' must be the first declaration of a file", null);
                } else {
                    throw error(
                            t,
                            "Unexpected " + t.describe(),
                            "Expected an import, const, action or timeline declaration");
                }
                skipSemicolons();
            }
            return new Program(file, assets, imports, constants, actions, timelines, start);
        }

        private Library library() {
            Token keyword = expectKeyword("library");
            String name = expect(TokenType.IDENT, "library name").text();
            List<LibraryImport> imports = new ArrayList<>();
            List<ActionDefinition> actions = new ArrayList<>();
            while (!peek().is(TokenType.EOF)) {
                Token t = peek();
                if (t.isKeyword("import") && peek(1).is(TokenType.LBRACE)) {
                    imports.add(libraryImport());
                } else if (t.isKeyword("action") || t.isKeyword("private") || t.isKeyword("endable")) {
                    actions.add(action());
                } else {
                    throw error(
                            t,
                            "Unexpected " + t.describe() + " in library",
                            "Libraries may only contain imports and actions");
                }
                skipSemicolons();
            }
            return new Library(file, name, imports, actions, keyword.location(file));
        }

        // --- Declarations ---

        private AssetImport assetImport() {
            Token keyword = advance();
            AssetImport.Form form = switch (keyword.text()) {
                case "styles" -> AssetImport.Form.STYLES;
                case "layout" -> AssetImport.Form.LAYOUT;
                default -> AssetImport.Form.PROVIDER;
            };
            String path = expect(TokenType.STRING, "asset path").text();
            return new AssetImport(form, null, path, keyword.location(file));
        }

        private AssetImport namedImport() {
            Token keyword = expectKeyword("import");
            String name = expect(TokenType.IDENT, "import name").text();
            expectKeyword("from");
            String path = expect(TokenType.STRING, "asset path").text();
            return new AssetImport(AssetImport.Form.NAMED, name, path, keyword.location(file));
        }

        private LibraryImport libraryImport() {
            Token keyword = expectKeyword("import");
            expect(TokenType.LBRACE, "'{'");
            List<String> names = new ArrayList<>();
            if (!peek().is(TokenType.RBRACE)) {
                do {
                    names.add(expect(TokenType.IDENT, "action name").text());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RBRACE, "'}'");
            expectKeyword("from");
            String path = expect(TokenType.STRING, "library path").text();
            return new LibraryImport(names, path, keyword.location(file));
        }

        private VariableDeclaration constDeclaration() {
            expectKeyword("const");
            Token name = expect(TokenType.IDENT, "constant name");
            expect(TokenType.ASSIGN, "'='");
            Expression value = expression();
            return new VariableDeclaration(name.text(), value, name.location(file));
        }

        private ActionDefinition action() {
            Token first = peek();
            boolean isPrivate = false;
            boolean endable = false;
            while (peek().isKeyword("private") || peek().isKeyword("endable")) {
                if (advance().text().equals("private")) {
                    isPrivate = true;
                } else {
                    endable = true;
                }
            }
            expectKeyword("action");
            Token name = expect(TokenType.IDENT, "action name");
            expect(TokenType.LPAREN, "'('");
            List<Parameter> parameters = new ArrayList<>();
            if (!peek().is(TokenType.RPAREN)) {
                do {
                    Token paramName = expect(TokenType.IDENT, "parameter name");
                    String type = null;
                    if (match(TokenType.COLON)) {
                        type = expect(TokenType.IDENT, "parameter type").text();
                    }
                    parameters.add(new Parameter(paramName.text(), type, paramName.location(file)));
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN, "')'");

            List<Statement> startBody = operationBlock();
            List<Statement> endBody = List.of();
            if (endable) {
                if (!peek().is(TokenType.LBRACKET)) {
                    throw error(
                            peek(),
                            "Endable action '" + name.text() + "' requires an end block",
                            "Add a second [ ... ] block with the operations to run when the action ends");
                }
                endBody = operationBlock();
            } else if (peek().is(TokenType.LBRACKET)) {
                throw error(
                        peek(),
                        "Action '" + name.text() + "' has an end block but is not declared endable",
                        "Declare it as 'endable action " + name.text() + "'");
            }
            return new ActionDefinition(
                    name.text(), parameters, startBody, endBody, isPrivate, endable, first.location(file));
        }

        private Timeline timeline() {
            Token keyword = expectKeyword("timeline");
            String name = expect(TokenType.STRING, "timeline name").text();
            expectKeyword("in");
            String selector = expect(TokenType.STRING, "container selector").text();
            expectKeyword("using");
            String provider = expect(TokenType.IDENT, "timeline provider").text();
            String source = null;
            if (peek().isKeyword("from")) {
                advance();
                source = expect(TokenType.STRING, "media source").text();
            }
            expect(TokenType.LBRACE, "'{'");
            List<TimelineEvent> events = new ArrayList<>();
            while (!peek().is(TokenType.RBRACE)) {
                events.add(timelineEvent());
                skipSemicolons();
            }
            expect(TokenType.RBRACE, "'}'");
            return new Timeline(name, selector, provider, source, events, keyword.location(file));
        }

        private TimelineEvent timelineEvent() {
            Token keyword = expectKeyword("at");
            Expression start = timeExpression();
            expect(TokenType.RANGE, "'..'");
            Expression end = timeExpression();
            if (peek().is(TokenType.LBRACKET)) {
                List<Statement> startBody = operationBlock();
                List<Statement> endBody = peek().is(TokenType.LBRACKET) ? operationBlock() : List.of();
                return new TimelineEvent(start, end, null, startBody, endBody, keyword.location(file));
            }
            Token name = expect(TokenType.IDENT, "action call or '['");
            OperationCall call = callAfterName(name);
            return new TimelineEvent(start, end, call, List.of(), List.of(), keyword.location(file));
        }

        private Expression timeExpression() {
            Expression left = timeLiteral();
            while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
                Token op = advance();
                Expression right = timeLiteral();
                left = new Reference.BinaryExpression(op.text(), left, right, op.location(file));
            }
            return left;
        }

        private Expression timeLiteral() {
            Token t = peek();
            if (t.is(TokenType.TIME) || t.is(TokenType.NUMBER)) {
                advance();
                return new Literal.NumberLiteral(t.seconds(), t.location(file));
            }
            throw error(t, "Expected a time value but found " + t.describe(), "Write times as 5s or 250ms");
        }

        // --- Statements ---

        private List<Statement> operationBlock() {
            expect(TokenType.LBRACKET, "'['");
            List<Statement> statements = statementsUntil(TokenType.RBRACKET);
            expect(TokenType.RBRACKET, "']'");
            return statements;
        }

        private List<Statement> braceBlock() {
            expect(TokenType.LBRACE, "'{'");
            List<Statement> statements = statementsUntil(TokenType.RBRACE);
            expect(TokenType.RBRACE, "'}'");
            return statements;
        }

        private List<Statement> statementsUntil(TokenType closer) {
            List<Statement> statements = new ArrayList<>();
            while (!peek().is(closer)) {
                if (peek().is(TokenType.EOF)) {
                    throw error(peek(), "Unexpected end of input, block is not closed", null);
                }
                statements.add(statement());
                skipSemicolons();
            }
            return statements;
        }

        private Statement statement() {
            Token t = peek();
            if (t.isKeyword("if")) {
                return ifStatement();
            }
            if (t.isKeyword("for")) {
                return forStatement();
            }
            if (t.isKeyword("const")) {
                return constDeclaration();
            }
            if (t.isKeyword("break")) {
                advance();
                return new BreakStatement(t.location(file));
            }
            if (t.isKeyword("continue")) {
                advance();
                return new ContinueStatement(t.location(file));
            }
            if (t.is(TokenType.IDENT) && !RESERVED.contains(t.text())) {
                advance();
                return callAfterName(t);
            }
            throw error(t, "Unexpected " + t.describe(), "Expected an operation call or a control-flow statement");
        }

        private IfStatement ifStatement() {
            Token keyword = expectKeyword("if");
            expect(TokenType.LPAREN, "'('");
            Expression condition = expression();
            expect(TokenType.RPAREN, "')'");
            List<Statement> thenBranch = braceBlock();
            List<Statement> elseBranch = List.of();
            if (peek().isKeyword("else")) {
                advance();
                if (peek().isKeyword("if")) {
                    elseBranch = List.of(ifStatement());
                } else {
                    elseBranch = braceBlock();
                }
            }
            return new IfStatement(condition, thenBranch, elseBranch, keyword.location(file));
        }

        private ForStatement forStatement() {
            Token keyword = expectKeyword("for");
            expect(TokenType.LPAREN, "'('");
            String item = expect(TokenType.IDENT, "loop variable").text();
            expectKeyword("in");
            Expression collection = expression();
            expect(TokenType.RPAREN, "')'");
            List<Statement> body = braceBlock();
            return new ForStatement(item, collection, body, keyword.location(file));
        }

        private OperationCall callAfterName(Token name) {
            expect(TokenType.LPAREN, "'(' after '" + name.text() + "'");
            List<Expression> args = new ArrayList<>();
            if (!peek().is(TokenType.RPAREN)) {
                do {
                    args.add(expression());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN, "')'");
            return new OperationCall(name.text(), args, name.location(file));
        }

        // --- Expressions (precedence climbing) ---

        private Expression expression() {
            return binary(0);
        }

        private static final List<Set<TokenType>> LEVELS = List.of(
                Set.of(TokenType.OR),
                Set.of(TokenType.AND),
                Set.of(TokenType.EQ, TokenType.NEQ),
                Set.of(TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE),
                Set.of(TokenType.PLUS, TokenType.MINUS),
                Set.of(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT));

        private Expression binary(int level) {
            if (level == LEVELS.size()) {
                return unary();
            }
            Expression left = binary(level + 1);
            while (LEVELS.get(level).contains(peek().type())) {
                Token op = advance();
                Expression right = binary(level + 1);
                left = new Reference.BinaryExpression(op.text(), left, right, op.location(file));
            }
            return left;
        }

        private Expression unary() {
            if (peek().is(TokenType.BANG) || peek().is(TokenType.MINUS)) {
                Token op = advance();
                return new Reference.UnaryExpression(op.text(), unary(), op.location(file));
            }
            return primary();
        }

        private Expression primary() {
            Token t = advance();
            return switch (t.type()) {
                case STRING -> new Literal.StringLiteral(t.text(), t.location(file));
                case NUMBER -> new Literal.NumberLiteral(Double.parseDouble(t.text()), t.location(file));
                case TIME -> new Literal.NumberLiteral(t.seconds(), t.location(file));
                case LPAREN -> {
                    Expression inner = expression();
                    expect(TokenType.RPAREN, "')'");
                    yield inner;
                }
                case LBRACE -> objectLiteral(t);
                case LBRACKET -> arrayLiteral(t);
                case AT_AT -> new Reference.SystemPropertyReference(
                        expect(TokenType.IDENT, "system property name").text(), t.location(file));
                case AT -> new Reference.VariableReference(
                        expect(TokenType.IDENT, "variable name").text(), t.location(file));
                case DOLLAR -> propertyChain(t);
                case IDENT -> identifier(t);
                default -> throw error(t, "Expected an expression but found " + t.describe(), null);
            };
        }

        private Expression identifier(Token t) {
            return switch (t.text()) {
                case "true" -> new Literal.BooleanLiteral(true, t.location(file));
                case "false" -> new Literal.BooleanLiteral(false, t.location(file));
                case "null" -> new Literal.NullLiteral(t.location(file));
                default -> {
                    if (peek().is(TokenType.LPAREN)) {
                        throw error(
                                t,
                                "Operation calls cannot be used as values",
                                "Call '" + t.text() + "' as a statement instead");
                    }
                    yield new Reference.NameReference(t.text(), t.location(file));
                }
            };
        }

        private Expression propertyChain(Token dollar) {
            List<String> segments = new ArrayList<>();
            segments.add(expect(TokenType.IDENT, "property name after '$'").text());
            while (peek().is(TokenType.DOT)) {
                advance();
                segments.add(expect(TokenType.IDENT, "property name").text());
            }
            return new Reference.PropertyChain(segments, dollar.location(file));
        }

        private Expression objectLiteral(Token open) {
            List<Literal.Property> properties = new ArrayList<>();
            if (!peek().is(TokenType.RBRACE)) {
                do {
                    if (peek().is(TokenType.RBRACE)) {
                        break;
                    }
                    Token key = peek();
                    if (!key.is(TokenType.IDENT) && !key.is(TokenType.STRING)) {
                        throw error(key, "Expected a property name but found " + key.describe(), null);
                    }
                    advance();
                    expect(TokenType.COLON, "':'");
                    properties.add(new Literal.Property(key.text(), expression()));
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RBRACE, "'}'");
            return new Literal.ObjectLiteral(properties, open.location(file));
        }

        private Expression arrayLiteral(Token open) {
            List<Expression> elements = new ArrayList<>();
            if (!peek().is(TokenType.RBRACKET)) {
                do {
                    if (peek().is(TokenType.RBRACKET)) {
                        break;
                    }
                    elements.add(expression());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RBRACKET, "']'");
            return new Literal.ArrayLiteral(elements, open.location(file));
        }

        // --- Token helpers ---

        private Token peek() {
            return tokens.get(index);
        }

        private Token peek(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private Token advance() {
            Token t = tokens.get(index);
            if (!t.is(TokenType.EOF)) {
                index++;
            }
            return t;
        }

        private boolean match(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private void skipSemicolons() {
            while (match(TokenType.SEMICOLON)) {
                // consume
            }
        }

        private Token expect(TokenType type, String what) {
            Token t = peek();
            if (!t.is(type)) {
                throw error(t, "Expected " + what + " but found " + t.describe(), null);
            }
            return advance();
        }

        private Token expectKeyword(String keyword) {
            Token t = peek();
            if (!t.isKeyword(keyword)) {
                throw error(t, "Expected '" + keyword + "' but found " + t.describe(), null);
            }
            return advance();
        }

        private ParseException error(Token at, String message, String hint) {
            return new ParseException(message, at.location(file), hint);
        }
    }
}
