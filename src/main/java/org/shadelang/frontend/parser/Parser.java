package org.shadelang.frontend.parser;

import org.shadelang.frontend.astnode.*;
import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.frontend.lexer.LexerTokenType;
import org.shadelang.runtime.ErrorMessageUtil;
import org.shadelang.runtime.runtimetypes.ShadeParserException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.shadelang.frontend.parser.TokenUtils.consume;
import static org.shadelang.frontend.parser.TokenUtils.peek;

/**
 * Recursive descent parser that turns the token list into a {@link ProgramNode}.
 * <p>
 * The parser also enforces the naming rules the symbol allocator relies on:
 * program parameter names are unique across the in and out lists, function names
 * are unique, and the parameters of one function have distinct names.
 */
public class Parser {
    public final List<LexerToken> tokens;
    public final ErrorMessageUtil errorUtil;
    public int tokenIndex = 0;

    private final Set<String> globalNames = new HashSet<>();
    private final Set<String> functionNames = new HashSet<>();

    public Parser(List<LexerToken> tokens, ErrorMessageUtil errorUtil) {
        this.tokens = tokens;
        this.errorUtil = errorUtil;
    }

    public ProgramNode parse() {
        List<ParameterNode> inParameters = new ArrayList<>();
        List<ParameterNode> outParameters = new ArrayList<>();
        List<FunctionNode> functions = new ArrayList<>();

        while (true) {
            LexerToken token = peek(this);
            if (token.type == LexerTokenType.EOF) {
                break;
            }
            if (token.type == LexerTokenType.IDENTIFIER) {
                switch (token.text) {
                    case "in" -> {
                        inParameters.add(parseGlobalDeclaration());
                        continue;
                    }
                    case "out" -> {
                        outParameters.add(parseGlobalDeclaration());
                        continue;
                    }
                    case "fn" -> {
                        functions.add(parseFunction());
                        continue;
                    }
                    default -> {
                    }
                }
            }
            throw syntaxError("Expected 'in', 'out' or 'fn' but found '" + TokenUtils.describe(token) + "'");
        }
        return new ProgramNode(inParameters, outParameters, functions);
    }

    ShadeParserException syntaxError(String message) {
        return new ShadeParserException(tokenIndex, message, errorUtil);
    }

    private ParameterNode parseGlobalDeclaration() {
        consume(this);  // "in" or "out"
        ParameterNode parameter = parseTypedName();
        if (!globalNames.add(parameter.name)) {
            tokenIndex = parameter.tokenIndex;
            throw syntaxError("Parameter '" + parameter.name + "' is already declared");
        }
        consume(this, LexerTokenType.OPERATOR, ";");
        return parameter;
    }

    private ParameterNode parseTypedName() {
        TypeKind type = parseType();
        int index = peekIndex();
        String name = consume(this, LexerTokenType.IDENTIFIER).text;
        return new ParameterNode(name, type, index);
    }

    private TypeKind parseType() {
        LexerToken token = peek(this);
        TypeKind type = token.type == LexerTokenType.IDENTIFIER ? TypeKind.fromKeyword(token.text) : null;
        if (type == null) {
            throw syntaxError("Expected a type but found '" + TokenUtils.describe(token) + "'");
        }
        tokenIndex++;
        return type;
    }

    private FunctionNode parseFunction() {
        consume(this, LexerTokenType.IDENTIFIER, "fn");
        int index = peekIndex();
        String name = consume(this, LexerTokenType.IDENTIFIER).text;
        if (!functionNames.add(name)) {
            tokenIndex = index;
            throw syntaxError("Function '" + name + "' is already defined");
        }

        consume(this, LexerTokenType.OPERATOR, "(");
        List<ParameterNode> parameters = new ArrayList<>();
        Set<String> parameterNames = new HashSet<>();
        if (!isOperator(")")) {
            do {
                ParameterNode parameter = parseTypedName();
                if (!parameterNames.add(parameter.name)) {
                    tokenIndex = parameter.tokenIndex;
                    throw syntaxError("Duplicate parameter '" + parameter.name + "' in function '" + name + "'");
                }
                parameters.add(parameter);
            } while (consumeIfOperator(","));
        }
        consume(this, LexerTokenType.OPERATOR, ")");

        TypeKind returnType = TypeKind.F32;
        if (consumeIfOperator("->")) {
            returnType = parseType();
        }

        consume(this, LexerTokenType.OPERATOR, "{");
        List<StatementNode> statements = new ArrayList<>();
        while (!isOperator("}")) {
            statements.add(parseStatement());
        }
        consume(this, LexerTokenType.OPERATOR, "}");
        return new FunctionNode(name, parameters, returnType, statements, index);
    }

    private StatementNode parseStatement() {
        LexerToken token = peek(this);
        int index = tokenIndex;
        if (token.type != LexerTokenType.IDENTIFIER) {
            throw syntaxError("Expected a statement but found '" + TokenUtils.describe(token) + "'");
        }
        StatementNode statement;
        if (token.text.equals("return")) {
            tokenIndex++;
            statement = new ReturnNode(parseExpression(), index);
        } else {
            tokenIndex++;
            consume(this, LexerTokenType.OPERATOR, "=");
            statement = new AssignmentNode(token.text, parseExpression(), index);
        }
        consume(this, LexerTokenType.OPERATOR, ";");
        return statement;
    }

    ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (isOperator("+") || isOperator("-")) {
            int index = tokenIndex;
            BinaryOperator op = BinaryOperator.fromSymbol(consume(this).text);
            left = new BinaryOperatorNode(op, left, parseTerm(), index);
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseUnary();
        while (isOperator("*") || isOperator("/")) {
            int index = tokenIndex;
            BinaryOperator op = BinaryOperator.fromSymbol(consume(this).text);
            left = new BinaryOperatorNode(op, left, parseUnary(), index);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (isOperator("-")) {
            int index = tokenIndex;
            consume(this);
            return new UnaryOperatorNode(UnaryOperator.NEG, parseUnary(), index);
        }
        if (isOperator("!")) {
            int index = tokenIndex;
            consume(this);
            return new UnaryOperatorNode(UnaryOperator.NOT, parseUnary(), index);
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        LexerToken token = peek(this);
        int index = tokenIndex;
        switch (token.type) {
            case NUMBER:
                tokenIndex++;
                return parseNumber(token.text, index);
            case IDENTIFIER:
                tokenIndex++;
                if (token.text.equals("true") || token.text.equals("false")) {
                    return LiteralNode.bool(token.text.equals("true"), index);
                }
                if (consumeIfOperator("(")) {
                    List<ExpressionNode> arguments = new ArrayList<>();
                    if (!isOperator(")")) {
                        do {
                            arguments.add(parseExpression());
                        } while (consumeIfOperator(","));
                    }
                    consume(this, LexerTokenType.OPERATOR, ")");
                    return new CallNode(token.text, arguments, index);
                }
                return new SymbolNode(token.text, index);
            case OPERATOR:
                if (token.text.equals("(")) {
                    tokenIndex++;
                    ExpressionNode inner = parseExpression();
                    consume(this, LexerTokenType.OPERATOR, ")");
                    return inner;
                }
                break;
            default:
                break;
        }
        throw syntaxError("Expected an expression but found '" + TokenUtils.describe(token) + "'");
    }

    private ExpressionNode parseNumber(String text, int index) {
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return LiteralNode.decimal(Double.parseDouble(text), index);
            }
            return LiteralNode.integer(Long.parseLong(text), index);
        } catch (NumberFormatException e) {
            tokenIndex = index;
            throw syntaxError("Malformed number '" + text + "'");
        }
    }

    private int peekIndex() {
        peek(this);
        return tokenIndex;
    }

    private boolean isOperator(String text) {
        LexerToken token = peek(this);
        return token.type == LexerTokenType.OPERATOR && token.text.equals(text);
    }

    private boolean consumeIfOperator(String text) {
        if (isOperator(text)) {
            tokenIndex++;
            return true;
        }
        return false;
    }
}
