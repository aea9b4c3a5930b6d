package frontend;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import frontend.ErrorHandler.Error.ErrorType;
import midend.dag.Node;
import midend.dag.OperationDAG;
import org.junit.Test;

public class ExpressionParserTest {

    private static OperationDAG parse(String text) {
        ExpressionParser.Result result = new ExpressionParser().parse(text);
        assertTrue("unexpected error " + result.getError(), result.isOk());
        return result.getDag();
    }

    private static ErrorHandler.Error parseError(String text) {
        ExpressionParser.Result result = new ExpressionParser().parse(text);
        assertFalse(result.isOk());
        assertNull(result.getDag());
        return result.getError();
    }

    private static Node child(OperationDAG dag, Node node, int index) {
        return dag.getNode(node.getChild(index));
    }

    @Test
    public void testSimpleSum() {
        OperationDAG dag = parse("a+b");
        Node root = dag.getRoot();
        assertThat(root.getTag(), is(Node.NodeTag.Operation));
        assertEquals("+", root.getValue());
        assertEquals("a", child(dag, root, 0).getValue());
        assertEquals("b", child(dag, root, 1).getValue());
        assertEquals(Node.NodeTag.Variable, child(dag, root, 0).getTag());
        assertEquals(3, dag.size());
    }

    @Test
    public void testPrecedence() {
        OperationDAG dag = parse("a+b*c");
        Node root = dag.getRoot();
        assertEquals("+", root.getValue());
        assertEquals("a", child(dag, root, 0).getValue());
        Node product = child(dag, root, 1);
        assertEquals("*", product.getValue());
        assertEquals("b", child(dag, product, 0).getValue());
        assertEquals("c", child(dag, product, 1).getValue());
    }

    @Test
    public void testLeftAssociativity() {
        OperationDAG dag = parse("a-b-c");
        Node root = dag.getRoot();
        assertEquals("-", root.getValue());
        assertEquals("c", child(dag, root, 1).getValue());
        Node inner = child(dag, root, 0);
        assertEquals("-", inner.getValue());
        assertEquals("a", child(dag, inner, 0).getValue());
        assertEquals("b", child(dag, inner, 1).getValue());

        dag = parse("a/b*c");
        assertEquals("*", dag.getRoot().getValue());
        assertEquals("/", child(dag, dag.getRoot(), 0).getValue());
    }

    @Test
    public void testParenthesesOverridePrecedence() {
        OperationDAG dag = parse("(a+b)*c");
        Node root = dag.getRoot();
        assertEquals("*", root.getValue());
        assertEquals("+", child(dag, root, 0).getValue());

        dag = parse("((x))");
        assertEquals(1, dag.size());
        assertEquals("x", dag.getRoot().getValue());
    }

    @Test
    public void testWhitespaceAndMultiplicationGlyph() {
        OperationDAG dag = parse(" a ×  b\t+ c ");
        Node root = dag.getRoot();
        assertEquals("+", root.getValue());
        assertEquals("*", child(dag, root, 0).getValue());
        assertEquals("*", parse("x·y").getRoot().getValue());
    }

    @Test
    public void testMultiCharacterTokens() {
        OperationDAG dag = parse("count_1 * 42");
        assertEquals("count_1", child(dag, dag.getRoot(), 0).getValue());
        assertEquals("42", child(dag, dag.getRoot(), 1).getValue());
        assertEquals("$", parse("$").getRoot().getValue());
    }

    @Test
    public void testNoCommonSubexpressionMerging() {
        OperationDAG dag = parse("(a+b)*(a+b)");
        assertEquals(7, dag.size());
    }

    @Test
    public void testIdsFollowCreationOrder() {
        OperationDAG dag = parse("a+b");
        assertEquals(0, child(dag, dag.getRoot(), 0).getId());
        assertEquals(1, child(dag, dag.getRoot(), 1).getId());
        assertEquals(2, dag.getRoot().getId());
    }

    @Test
    public void testMissingOperand() {
        ErrorHandler.Error error = parseError("a+");
        assertEquals(ErrorType.SyntaxError, error.getType());
        assertThat(error.getMessage(), containsString("missing operand"));
        assertEquals("a+", error.getOffending());

        assertEquals(ErrorType.SyntaxError, parseError("*a").getType());
        assertEquals(ErrorType.SyntaxError, parseError("a*-b").getType());
        assertEquals(ErrorType.SyntaxError, parseError("a+()").getType());
    }

    @Test
    public void testUnbalancedParentheses() {
        ErrorHandler.Error error = parseError("(a+b");
        assertEquals(ErrorType.SyntaxError, error.getType());
        assertEquals("(a+b", error.getOffending());

        error = parseError("a+b)");
        assertEquals(ErrorType.SyntaxError, error.getType());
        assertEquals("a+b)", error.getOffending());
    }

    @Test
    public void testUnrecognizedToken() {
        ErrorHandler.Error error = parseError("(a)(b)");
        assertEquals(ErrorType.SyntaxError, error.getType());
        assertEquals("(a)(b)", error.getOffending());
        assertEquals("a$b", parseError("x+a$b").getOffending());
    }

    @Test
    public void testEmptyInput() {
        assertEquals(ErrorType.EmptyInputError, parseError("").getType());
        assertEquals(ErrorType.EmptyInputError, parseError("   ").getType());
        assertEquals(ErrorType.EmptyInputError, parseError(null).getType());
    }

    private static String sum(int terms) {
        StringBuilder sb = new StringBuilder("a");
        for (int i = 1; i < terms; ++i) {
            sb.append("+a");
        }
        return sb.toString();
    }

    @Test
    public void testLongSumWithinLimit() {
        OperationDAG dag = parse(sum(500));
        assertEquals(999, dag.size());
        assertEquals("+", dag.getRoot().getValue());
        assertEquals("a", child(dag, dag.getRoot(), 1).getValue());
    }

    @Test
    public void testOverlongInputIsRejected() {
        ErrorHandler.Error error = parseError(sum(10000));
        assertEquals(ErrorType.SyntaxError, error.getType());
        assertThat(error.getMessage(), containsString("longer than 1000 characters"));
        // whitespace does not count against the limit
        assertTrue(new ExpressionParser().parse(sum(500).replace("+", " + ")).isOk());
    }

    @Test
    public void testGetOrThrow() {
        try {
            new ExpressionParser().parse("(a+b").getOrThrow();
            fail("expected an AnalysisException");
        } catch (ErrorHandler.AnalysisException e) {
            assertEquals(ErrorType.SyntaxError, e.getType());
            assertThat(e.getMessage(), containsString("(a+b"));
        }
        assertEquals("+", new ExpressionParser().parse("a+b").getOrThrow().getRoot().getValue());
    }
}
