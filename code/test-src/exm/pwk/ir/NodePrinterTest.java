package exm.pwk.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

public class NodePrinterTest {

  private NodeGraph g;
  private Node x, y;

  @Before
  public void setup() {
    g = new NodeGraph();
    x = g.var(OpCode.VAR_X);
    y = g.var(OpCode.VAR_Y);
  }

  @Test
  public void testExpressions() {
    assertEquals("x", NodePrinter.renderExpression(x));
    assertEquals("7", NodePrinter.renderExpression(g.intLit(7)));
    assertEquals("2.500000", NodePrinter.renderExpression(g.floatLit(2.5f)));
    assertEquals("(x+y)",
        NodePrinter.renderExpression(g.build(OpCode.PLUS, x, y)));
    assertEquals("(x-y)",
        NodePrinter.renderExpression(g.build(OpCode.MINUS, x, y)));
    assertEquals("(x+3)",
        NodePrinter.renderExpression(g.buildImm(OpCode.PLUS_IMM, 3, x)));
    assertEquals("(y*4)",
        NodePrinter.renderExpression(g.buildImm(OpCode.TIMES_IMM, 4, y)));
  }

  @Test
  public void testLoads() {
    Node load = g.build(OpCode.LOAD, x);
    assertEquals("[x]", NodePrinter.renderExpression(load));
    Node offset = g.build(OpCode.LOAD, g.build(OpCode.PLUS, x, g.intLit(3)));
    assertEquals("[x+3]", NodePrinter.renderExpression(offset));
    assertEquals("[x+3]", offset.toString());
  }

  @Test
  public void testFunctionCalls() {
    Node load = g.build(OpCode.LOAD, x);
    assertEquals("Sin([x])",
        NodePrinter.renderExpression(g.build(OpCode.SIN, load)));

    Node other = g.build(OpCode.LOAD, y);
    assertEquals("Each argument rendered in turn", "ATan2([x], [y])",
        NodePrinter.renderExpression(g.build(OpCode.ATAN2, load, other)));
  }

  @Test
  public void testUnbound() {
    Node u = g.unbound();
    String s = NodePrinter.renderExpression(u);
    assertEquals("<" + Long.toHexString(u.id()) + ">", s);
  }

  @Test
  public void testInstructions() {
    Node l1 = g.build(OpCode.LOAD, x);
    Node l2 = g.build(OpCode.LOAD, y);
    Node sum = g.build(OpCode.PLUS, l1, l2);
    l1.setReg(NodePrinter.FIRST_FLOAT_REG);
    l2.setReg(NodePrinter.FIRST_FLOAT_REG + 1);
    sum.setReg(NodePrinter.FIRST_FLOAT_REG + 2);
    assertEquals("xmm2 = xmm0 + xmm1", NodePrinter.renderInstruction(sum));

    Node shifted = g.buildImm(OpCode.PLUS_IMM, 4, x);
    x.setReg(1);
    shifted.setReg(2);
    assertEquals("r2 = r1 + 4", NodePrinter.renderInstruction(shifted));

    Node cmp = g.build(OpCode.NEQ, l1, g.floatLit(0.0f));
    cmp.setReg(3);
    assertEquals("r3 = NEQ xmm0 0.000000",
                 NodePrinter.renderInstruction(cmp));
  }

  @Test
  public void testUnassignedRegisters() {
    Node load = g.build(OpCode.LOAD, x);
    String s = NodePrinter.renderInstruction(load);
    assertTrue(s, s.startsWith("v" + load.id() + " = "));
    assertTrue(s, s.endsWith("v" + x.id()));
  }

  @Test
  public void testRenderingIsPure() {
    Node e = g.build(OpCode.COS, g.build(OpCode.LOAD,
                                 g.build(OpCode.PLUS, x, y)));
    int before = g.size();
    NodePrinter.renderExpression(e);
    NodePrinter.renderInstruction(e);
    assertEquals(before, g.size());
  }
}
