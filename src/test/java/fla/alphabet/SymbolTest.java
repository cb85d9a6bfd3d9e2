package fla.alphabet;

import java.util.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTest {

	@Test
	public void testValueEquality(){
		assertEquals(Symbol.of("a"), Symbol.of('a'));
		assertEquals(Symbol.of("a").hashCode(), Symbol.of('a').hashCode());
		assertNotEquals(Symbol.of("a"), Symbol.of("b"));
		assertEquals(StateId.of("q1"), StateId.numbered(1));
	}

	@Test
	public void testChars(){
		assertEquals(Arrays.asList(Symbol.of("a"), Symbol.of("b"), Symbol.of("b")), Symbol.chars("abb"));
		assertTrue(Symbol.chars("").isEmpty());
		assertEquals(2, Symbol.chars("ä€").size());
	}

	@Test
	public void testWords(){
		assertEquals(Arrays.asList(Symbol.of("id"), Symbol.of("+"), Symbol.of("id")), Symbol.words(" id  + id "));
		assertTrue(Symbol.words("  ").isEmpty());
		assertEquals("id+id", Symbol.join(Symbol.words("id + id")));
	}

	@Test
	public void testInvalidNames(){
		assertThrows(IllegalArgumentException.class, () -> Symbol.of(""));
		assertThrows(IllegalArgumentException.class, () -> StateId.of(""));
		assertThrows(NullPointerException.class, () -> Symbol.of((String) null));
	}

	@Test
	public void testStateOrder(){
		List<StateId> states = new ArrayList<>(Arrays.asList(StateId.numbered(10), StateId.numbered(2), StateId.numbered(1)));
		Collections.sort(states);
		assertEquals(Arrays.asList(StateId.numbered(1), StateId.numbered(2), StateId.numbered(10)), states);
	}
}
