package fla.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DotUtilsTest {

	@Test
	public void testParallelEdgesAreMerged(){
		String dot = new DotUtils("test")
				.state("a", false).state("b", true).initial("a")
				.edge("a", "b", "x").edge("a", "b", "y").edge("b", "b", "z")
				.toGraph().toString();
		assertTrue(dot.startsWith("digraph"), dot);
		assertTrue(dot.contains("x, y"), dot);
		assertTrue(dot.contains("doublecircle"), dot);
		assertTrue(dot.contains(DotUtils.INITIAL_MARKER), dot);
	}
}
