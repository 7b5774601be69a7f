package exm.pwk.ir.opt;

import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

public class ConstantFolderTest {

  private NodeGraph g;

  @Before
  public void setup() {
    g = new NodeGraph();
  }

  private Node fold(OpCode op, Type t, int ival, Node ...inputs) {
    return ConstantFolder.fold(g, op, t, Arrays.asList(inputs), ival);
  }

  @Test
  public void testArithmetic() {
    assertSame(g.intLit(12),
        fold(OpCode.TIMES, Type.INT, 0, g.intLit(3), g.intLit(4)));
    assertSame(g.floatLit(-1.5f),
        fold(OpCode.MINUS, Type.FLOAT, 0, g.floatLit(1.0f), g.floatLit(2.5f)));
    assertSame(g.floatLit(0.25f),
        fold(OpCode.DIVIDE, Type.FLOAT, 0, g.floatLit(1.0f), g.floatLit(4.0f)));
    assertSame(g.intLit(9), fold(OpCode.PLUS_IMM, Type.INT, 4, g.intLit(5)));
    assertSame(g.intLit(20), fold(OpCode.TIMES_IMM, Type.INT, 4, g.intLit(5)));
  }

  @Test
  public void testIntWraps() {
    assertSame(g.intLit(Integer.MIN_VALUE),
        fold(OpCode.PLUS, Type.INT, 0, g.intLit(Integer.MAX_VALUE),
             g.intLit(1)));
  }

  @Test
  public void testMasks() {
    Node one = g.intLit(1);
    Node zero = g.intLit(0);
    Node seven = g.intLit(7);
    assertSame(seven, fold(OpCode.AND, Type.INT, 0, one, seven));
    assertSame(zero, fold(OpCode.AND, Type.INT, 0, zero, seven));
    assertSame(zero, fold(OpCode.NAND, Type.INT, 0, one, seven));
    assertSame(seven, fold(OpCode.NAND, Type.INT, 0, zero, seven));
    assertSame(g.floatLit(2.0f),
        fold(OpCode.AND, Type.FLOAT, 0, one, g.floatLit(2.0f)));
    assertSame(g.floatLit(0.0f),
        fold(OpCode.NAND, Type.FLOAT, 0, one, g.floatLit(2.0f)));
  }

  @Test
  public void testOr() {
    assertSame(g.intLit(7),
        fold(OpCode.OR, Type.INT, 0, g.intLit(5), g.intLit(2)));
    // Masked float values combine by addition
    assertSame(g.floatLit(3.0f),
        fold(OpCode.OR, Type.FLOAT, 0, g.floatLit(0.0f), g.floatLit(3.0f)));
  }

  @Test
  public void testConversions() {
    assertSame(g.floatLit(3.0f),
        fold(OpCode.INT_TO_FLOAT, Type.FLOAT, 0, g.intLit(3)));
    assertSame(g.intLit(2),
        fold(OpCode.FLOAT_TO_INT, Type.INT, 0, g.floatLit(2.7f)));
    assertSame(g.intLit(-2),
        fold(OpCode.FLOAT_TO_INT, Type.INT, 0, g.floatLit(-2.7f)));
  }

  @Test
  public void testNotFolded() {
    Node f = g.floatLit(1.0f);
    assertNull(fold(OpCode.SIN, Type.FLOAT, 0, f));
    assertNull(fold(OpCode.POWER, Type.FLOAT, 0, f, f));
    assertNull(fold(OpCode.FLOOR, Type.FLOAT, 0, f));
    assertNull(fold(OpCode.LT, Type.BOOL, 0, f, f));

    Node x = g.var(OpCode.VAR_X);
    assertNull("Not a literal", fold(OpCode.PLUS, Type.INT, 0, x, g.intLit(1)));

    Node sin = g.build(OpCode.SIN, f);
    assertNull("No dependencies but no value either",
        fold(OpCode.PLUS, Type.FLOAT, 0, sin, f));
  }

  @Test
  public void testThroughBuilder() {
    assertSame(g.floatLit(0.5f),
        g.build(OpCode.MINUS, g.floatLit(1.5f), g.intLit(1)));
    assertSame(g.intLit(6),
        g.build(OpCode.TIMES, g.intLit(2), g.buildImm(OpCode.PLUS_IMM, 1,
                                                      g.intLit(2))));
  }
}
