package exm.pwk.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Random;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.pwk.common.Logging;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

public class SumCanonicalizerTest {

  private NodeGraph g;
  private Node x, y, t;

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging("target/SumCanonicalizerTest.pwk.log", true);
  }

  @Before
  public void setup() {
    g = new NodeGraph();
    x = g.var(OpCode.VAR_X);
    y = g.var(OpCode.VAR_Y);
    t = g.var(OpCode.VAR_T);
  }

  private Node canon(Node n) {
    return SumCanonicalizer.canonicalize(g, n);
  }

  @Test
  public void testNotASum() {
    assertSame(x, canon(x));
    Node load = g.build(OpCode.LOAD, x);
    assertSame(load, canon(load));
  }

  @Test
  public void testOrderedByLevel() {
    Node sum = g.build(OpCode.PLUS, g.build(OpCode.PLUS, x, t), y);
    Node c = canon(sum);
    assertEquals("((t+y)+x)", c.toString());
  }

  @Test
  public void testIdempotent() {
    Node e = g.build(OpCode.PLUS,
                     g.build(OpCode.PLUS, x, g.intLit(3)),
                     g.build(OpCode.MINUS, y, g.intLit(1)));
    Node c1 = canon(e);
    assertEquals(OpCode.PLUS_IMM, c1.op());
    assertEquals(2, c1.ival());
    assertEquals("((y+x)+2)", c1.toString());
    assertSame(c1, canon(c1));
  }

  @Test
  public void testRepeatedTermsIdempotent() {
    Node c1 = canon(g.build(OpCode.MINUS, t, g.build(OpCode.PLUS, t, t)));
    assertEquals("((t-t)-t)", c1.toString());
    assertSame(c1, canon(c1));

    Node c2 = canon(g.build(OpCode.MINUS, y, g.build(OpCode.PLUS, t, y)));
    assertEquals("((y-t)-y)", c2.toString());
    assertSame(c2, canon(c2));

    Node c3 = canon(g.build(OpCode.MINUS,
                            g.build(OpCode.MINUS, g.intLit(0), x), y));
    assertSame(c3, canon(c3));

    // t - t - t with y and a constant on top
    Node e = g.build(OpCode.PLUS,
        g.build(OpCode.MINUS,
            g.build(OpCode.MINUS, t, g.build(OpCode.PLUS, t, t)), y),
        g.intLit(16));
    Node c4 = canon(e);
    assertEquals("((((t-t)-t)-y)+16)", c4.toString());
    assertSame(c4, canon(c4));
    assertSame(c4, g.optimize(g.optimize(e)));
  }

  private Node randomSum(Random r, int depth) {
    if (depth == 0 || r.nextInt(4) == 0) {
      switch (r.nextInt(4)) {
        case 0: return x;
        case 1: return y;
        case 2: return t;
        default: return g.intLit(r.nextInt(21) - 10);
      }
    }
    switch (r.nextInt(3)) {
      case 0:
        return g.build(OpCode.PLUS, randomSum(r, depth - 1),
                       randomSum(r, depth - 1));
      case 1:
        return g.build(OpCode.MINUS, randomSum(r, depth - 1),
                       randomSum(r, depth - 1));
      default:
        return g.buildImm(OpCode.PLUS_IMM, r.nextInt(21) - 10,
                          randomSum(r, depth - 1));
    }
  }

  @Test
  public void testRandomSumsIdempotent() {
    Random r = new Random(12345);
    for (int i = 0; i < 2000; i++) {
      Node e = randomSum(r, 4);
      Node c = canon(e);
      assertSame(e + " => " + c, c, canon(c));
    }
  }

  @Test
  public void testIntConstantOutermost() {
    Node e = g.build(OpCode.PLUS, g.intLit(5), g.build(OpCode.PLUS, x, y));
    Node c = canon(e);
    assertEquals(OpCode.PLUS_IMM, c.op());
    assertEquals(5, c.ival());
  }

  @Test
  public void testFloatConstantInnermost() {
    Node l = g.build(OpCode.LOAD, x);
    Node fy = g.coerce(y, Type.FLOAT);
    Node e = g.build(OpCode.PLUS, g.build(OpCode.PLUS, l, g.floatLit(2.5f)),
                     fy);
    Node c = canon(e);
    // (2.5 + y) + [x]
    assertEquals(OpCode.PLUS, c.op());
    assertSame(l, c.input(1));
    Node inner = c.input(0);
    assertSame(g.floatLit(2.5f), inner.input(0));
    assertSame(fy, inner.input(1));
  }

  @Test
  public void testFloatConstantBeforeNegatedTerm() {
    Node l = g.build(OpCode.LOAD, x);
    Node e = g.build(OpCode.MINUS, g.floatLit(1.0f), l);
    // 1 - [x] is already canonical
    assertSame(e, canon(e));

    // Equal terms are not cancelled
    Node c2 = canon(g.build(OpCode.PLUS, e, l));
    assertEquals("((1.000000+[x])-[x])", c2.toString());
    assertSame(c2, canon(c2));
  }

  @Test
  public void testNegatedChain() {
    Node e = g.build(OpCode.MINUS, g.intLit(0), x);
    assertSame("0 - x is already canonical", e, canon(e));

    Node e5 = g.build(OpCode.MINUS, g.intLit(5), x);
    assertSame(e5, canon(e5));

    Node both = g.build(OpCode.MINUS, g.build(OpCode.MINUS, g.intLit(0), x),
                        y);
    assertEquals("(0-(y+x))", canon(both).toString());
  }

  @Test
  public void testImmediateTakesSign() {
    // x - (y + 3) = (x - y) - 3
    Node shifted = g.buildImm(OpCode.PLUS_IMM, 3, y);
    Node c = canon(g.build(OpCode.MINUS, x, shifted));
    assertEquals(OpCode.PLUS_IMM, c.op());
    assertEquals(-3, c.ival());
    assertEquals("(x-y)", c.input(0).toString());
  }

  @Test
  public void testCancellation() {
    Node e = g.build(OpCode.PLUS, g.build(OpCode.PLUS, x, g.intLit(3)),
                     g.intLit(-3));
    assertSame(x, canon(e));

    Node e2 = g.build(OpCode.MINUS, g.build(OpCode.PLUS, x, y), y);
    assertEquals("Terms are not cancelled, only constants",
                 "((y-y)+x)", canon(e2).toString());
  }

  @Test
  public void testCanonicalisedBelowNonSum() {
    Node sum = g.build(OpCode.PLUS, g.build(OpCode.PLUS, x, g.intLit(1)), y);
    Node sin = g.build(OpCode.SIN, sum);
    Node conv = sin.input(0);
    assertEquals(OpCode.INT_TO_FLOAT, conv.op());
    assertEquals("((y+x)+1)", conv.input(0).toString());
  }

  @Test
  public void testOptimize() {
    Node e = g.build(OpCode.PLUS, g.build(OpCode.PLUS, x, t), g.intLit(4));
    assertSame(canon(e), g.optimize(e));
    assertSame(x, g.optimize(x));
  }
}
