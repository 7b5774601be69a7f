package exm.pwk.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.pwk.common.Logging;

public class GarbageCollectorTest {

  private NodeGraph g;
  private Node x;

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging("target/GarbageCollectorTest.pwk.log", false);
  }

  @Before
  public void setup() {
    g = new NodeGraph();
    x = g.var(OpCode.VAR_X);
  }

  @Test
  public void testUnreachableFreed() {
    Node a = g.build(OpCode.LOAD, x);
    Node b = g.build(OpCode.SIN, a);
    assertEquals(3, g.size());

    g.collectGarbage(Arrays.asList(a));
    assertEquals(2, g.size());
    assertTrue(a.isLive());
    assertTrue(x.isLive());
    assertFalse(b.isLive());
    assertFalse(g.isLive(b));
  }

  @Test
  public void testReachableKept() {
    Node a = g.build(OpCode.LOAD, x);
    Node b = g.build(OpCode.SIN, a);
    g.collectGarbage(Arrays.asList(b));
    assertTrue("Input of root is kept", a.isLive());
    assertTrue(b.isLive());

    g.collectGarbage(Arrays.asList(a, b));
    assertTrue(a.isLive());
    assertTrue(b.isLive());
    assertEquals(3, g.size());
  }

  @Test
  public void testSharedSubexpression() {
    Node s = g.build(OpCode.LOAD, x);
    Node e = g.build(OpCode.PLUS, s, s);
    g.build(OpCode.COS, s);
    g.collectGarbage(Arrays.asList(e));
    assertEquals(3, g.size());
    assertEquals(Arrays.asList(x, s, e), g.nodes());
  }

  @Test
  public void testLiteralTableRebuilt() {
    Node five = g.intLit(5);
    Node half = g.floatLit(0.5f);
    Node keep = g.build(OpCode.PLUS, x, g.intLit(7));
    g.collectGarbage(Arrays.asList(keep));

    assertFalse(five.isLive());
    assertFalse(half.isLive());
    Node fresh = g.intLit(5);
    assertNotSame(five, fresh);
    assertTrue(fresh.isLive());
    assertNotSame(half, g.floatLit(0.5f));

    // Survivors are still the unique instances
    assertSame(keep.input(1), g.intLit(7));
    assertSame(x, g.var(OpCode.VAR_X));
  }

  @Test
  public void testAxisVariableRecreated() {
    Node y = g.var(OpCode.VAR_Y);
    g.collectGarbage(Arrays.asList(x));
    assertFalse(y.isLive());
    Node y2 = g.var(OpCode.VAR_Y);
    assertNotSame(y, y2);
    assertTrue(y2.isLive());
  }

  @Test
  public void testOutputsPruned() {
    Node a = g.build(OpCode.LOAD, x);
    Node b = g.build(OpCode.SIN, a);
    assertEquals(Arrays.asList(b), a.outputs());

    g.collectGarbage(Arrays.asList(a));
    assertTrue(a.outputs().isEmpty());

    // CSE must not find the dead node
    Node b2 = g.build(OpCode.SIN, a);
    assertNotSame(b, b2);
    assertTrue(b2.isLive());
    assertEquals(Arrays.asList(b2), a.outputs());
  }

  @Test
  public void testEmptyRoots() {
    g.build(OpCode.LOAD, x);
    g.collectGarbage(Collections.<Node>emptyList());
    assertEquals(0, g.size());
    assertFalse(x.isLive());
  }

  @Test
  public void testClear() {
    Node a = g.build(OpCode.LOAD, x);
    g.clear();
    assertEquals(0, g.size());
    assertFalse(a.isLive());
    assertFalse(x.isLive());
    Node x2 = g.var(OpCode.VAR_X);
    assertNotSame(x, x2);
    assertEquals(1, g.size());
  }
}
