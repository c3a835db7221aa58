package org.shadelang.frontend.analysis;

import org.junit.jupiter.api.Test;
import org.shadelang.frontend.astnode.*;
import org.shadelang.frontend.lexer.Lexer;
import org.shadelang.frontend.lexer.LexerToken;
import org.shadelang.frontend.parser.Parser;
import org.shadelang.runtime.ErrorMessageUtil;
import org.shadelang.runtime.runtimetypes.ErrorKind;
import org.shadelang.runtime.runtimetypes.ShadeCompilerException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantFoldingVisitorTest {

    private ErrorMessageUtil errorUtil;

    private ProgramNode parse(String code) {
        List<LexerToken> tokens = new Lexer(code).tokenize();
        errorUtil = new ErrorMessageUtil("fold.shd", tokens);
        return new Parser(tokens, errorUtil).parse();
    }

    private ExpressionNode foldReturn(String expression) {
        ProgramNode program = parse("fn f() { return " + expression + "; }");
        ConstantFoldingVisitor.fold(program, errorUtil);
        return program.functions.get(0).statements.get(0).expression;
    }

    @Test
    public void testDecimalArithmeticFolds() {
        LiteralNode literal = (LiteralNode) foldReturn("(1.0 + 2.0) * 3.0 - 4.5 / 1.5");

        assertEquals(LiteralKind.DECIMAL, literal.kind);
        assertEquals(6.0, literal.value);
    }

    @Test
    public void testFoldingUsesFloatPrecision() {
        LiteralNode literal = (LiteralNode) foldReturn("0.1 + 0.2");

        assertEquals(0.1f + 0.2f, (float) literal.value);
        assertEquals((double) (0.1f + 0.2f), literal.value);
    }

    @Test
    public void testNegatedLiteralFolds() {
        LiteralNode literal = (LiteralNode) foldReturn("-(2.0 * 4.0)");

        assertEquals(-8.0, literal.value);
    }

    @Test
    public void testIntegerArithmeticFolds() {
        LiteralNode literal = (LiteralNode) foldReturn("7 / 2 + 1");

        assertEquals(LiteralKind.INTEGER, literal.kind);
        assertEquals(4.0, literal.value);
    }

    @Test
    public void testNotOfBooleanLiteralFolds() {
        LiteralNode literal = (LiteralNode) foldReturn("!true");

        assertEquals(LiteralKind.BOOLEAN, literal.kind);
        assertFalse(literal.booleanValue());
    }

    @Test
    public void testMixedKindsAreLeftAlone() {
        assertInstanceOf(BinaryOperatorNode.class, foldReturn("1.0 + 2"));
    }

    @Test
    public void testSymbolsStopFolding() {
        BinaryOperatorNode node = (BinaryOperatorNode) foldReturn("a * (2.0 + 3.0)");

        assertInstanceOf(SymbolNode.class, node.left);
        assertEquals(5.0, ((LiteralNode) node.right).value);
    }

    @Test
    public void testCallArgumentsAreFolded() {
        CallNode call = (CallNode) foldReturn("Vec3(1.0 + 1.0, 2.0 * 2.0, x)");

        assertEquals(2.0, ((LiteralNode) call.arguments.get(0)).value);
        assertEquals(4.0, ((LiteralNode) call.arguments.get(1)).value);
        assertInstanceOf(SymbolNode.class, call.arguments.get(2));
    }

    @Test
    public void testAssignmentExpressionIsRewrittenInPlace() {
        ProgramNode program = parse("fn f() { x = 2.0 * 0.5; }");
        ConstantFoldingVisitor.fold(program, errorUtil);

        AssignmentNode assignment = (AssignmentNode) program.functions.get(0).statements.get(0);
        assertEquals(1.0, ((LiteralNode) assignment.expression).value);
        assertEquals("x", assignment.target);
    }

    @Test
    public void testDivisionByZero() {
        ShadeCompilerException e = assertThrows(ShadeCompilerException.class, () -> foldReturn("1.0 / 0.0"));

        assertEquals(ErrorKind.FOLDING, e.getKind());
        assertTrue(e.getMessage().startsWith("Division by zero in constant expression at fold.shd line 1"),
                e.getMessage());
    }

    @Test
    public void testIntegerDivisionByZero() {
        assertEquals(ErrorKind.FOLDING,
                assertThrows(ShadeCompilerException.class, () -> foldReturn("4 / (2 - 2)")).getKind());
    }

    @Test
    public void testFloatOverflow() {
        assertEquals(ErrorKind.FOLDING,
                assertThrows(ShadeCompilerException.class, () -> foldReturn("3.0e38 * 10.0")).getKind());
    }

    @Test
    public void testLiteralOutOfFloatRange() {
        ShadeCompilerException literal = assertThrows(ShadeCompilerException.class, () -> foldReturn("1e40"));
        ShadeCompilerException product = assertThrows(ShadeCompilerException.class, () -> foldReturn("1e40 * 1.0"));

        assertEquals(ErrorKind.FOLDING, literal.getKind());
        assertEquals(ErrorKind.FOLDING, product.getKind());
        assertTrue(literal.getMessage().startsWith(ConstantFoldingVisitor.FLOAT_OVERFLOW + " at fold.shd line 1"),
                literal.getMessage());
        assertTrue(product.getMessage().startsWith(ConstantFoldingVisitor.FLOAT_OVERFLOW + " at fold.shd line 1"),
                product.getMessage());
    }

    @Test
    public void testTinyLiteralUnderflowsToZero() {
        assertEquals(0.0f, (float) ((LiteralNode) foldReturn("1e-50")).value);
    }

    @Test
    public void testIntegerOverflow() {
        assertEquals(ErrorKind.FOLDING,
                assertThrows(ShadeCompilerException.class, () -> foldReturn("2147483647 + 1")).getKind());
    }

    @Test
    public void testFoldedTreePrints() {
        ProgramNode program = parse("in float a; fn f() { return a + 1.0 * 2.0; }");
        ConstantFoldingVisitor.fold(program, errorUtil);

        String printed = program.toString();
        assertTrue(printed.contains("in ParameterNode: float a"), printed);
        assertTrue(printed.contains("BinaryOperatorNode: +"), printed);
        assertTrue(printed.contains("LiteralNode: 2.0"), printed);
        assertFalse(printed.contains("BinaryOperatorNode: *"), printed);
    }
}
