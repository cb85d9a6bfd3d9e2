package fla.automata.pushdown;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;

import static org.junit.jupiter.api.Assertions.*;

public class PushdownAutomatonTest {

	/**
	 * Balanced parentheses, pushes an X per opening parenthesis
	 */
	static PushdownAutomaton balancedParentheses(){
		return new PushdownAutomatonBuilder()
				.states("q0", "q1").initial("q0", "Z").accepting("q1")
				.transition("q0", "(", "Z", "q0", "X", "Z")
				.transition("q0", "(", "X", "q0", "X", "X")
				.transition("q0", ")", "X", "q0")
				.epsilonTransition("q0", "Z", "q1", "Z")
				.build();
	}

	/**
	 * Guesses the middle of a palindrome over {a, b}
	 */
	static PushdownAutomaton evenPalindromes(){
		PushdownAutomatonBuilder builder = new PushdownAutomatonBuilder()
				.states("push", "pop", "accept").initial("push", "Z").accepting("accept");
		for (String symbol : new String[]{"a", "b"}){
			for (String top : new String[]{"a", "b", "Z"}){
				builder.transition("push", symbol, top, "push", symbol, top);
				builder.epsilonTransition("push", top, "pop", top);
			}
			builder.transition("pop", symbol, symbol, "pop");
		}
		return builder.epsilonTransition("pop", "Z", "accept", "Z").build();
	}

	/**
	 * Pushes forever without reading input
	 */
	static PushdownAutomaton endlessPusher(){
		return new PushdownAutomatonBuilder()
				.states("q0", "q1").inputAlphabet("a").initial("q0", "Z").accepting("q1")
				.epsilonTransition("q0", "Z", "q0", "Z", "Z")
				.build();
	}

	@Nested
	class BalancedParentheses {

		@ParameterizedTest
		@ValueSource(strings = {"", "()", "(())", "()()", "(()())"})
		public void testAccepted(String word){
			assertEquals(Verdict.ACCEPT, balancedParentheses().accepts(word, 1000));
		}

		@ParameterizedTest
		@ValueSource(strings = {"(()", ")", "())", "(", ")("})
		public void testRejected(String word){
			assertEquals(Verdict.REJECT, balancedParentheses().accepts(word, 1000));
		}

		@Test
		public void testSymbolOutsideOfAlphabet(){
			assertEquals(Verdict.REJECT, balancedParentheses().accepts("(a)", 1000));
		}
	}

	@Test
	public void testNonDeterministicGuess(){
		PushdownAutomaton pda = evenPalindromes();
		assertEquals(Verdict.ACCEPT, pda.accepts("abba", 1000));
		assertEquals(Verdict.ACCEPT, pda.accepts("", 1000));
		assertEquals(Verdict.REJECT, pda.accepts("abab", 1000));
		assertEquals(Verdict.REJECT, pda.accepts("aba", 1000));
	}

	@Test
	public void testInconclusiveOnInfiniteSearchSpace(){
		PushdownAutomaton.SearchResult result = endlessPusher().search(Symbol.chars("a"), 50, AcceptanceMode.FINAL_STATE);
		assertEquals(Verdict.INCONCLUSIVE, result.verdict);
		assertEquals(50, result.exploredConfigurations);
		assertFalse(result.acceptingConfiguration.isPresent());
	}

	@Test
	public void testSmallBudgetIsInconclusive(){
		assertEquals(Verdict.INCONCLUSIVE, balancedParentheses().accepts("(())", 2));
	}

	@Test
	public void testAcceptingConfiguration(){
		PushdownAutomaton.SearchResult result = balancedParentheses()
				.search(Symbol.chars("()"), 1000, AcceptanceMode.FINAL_STATE);
		assertEquals(Verdict.ACCEPT, result.verdict);
		Configuration configuration = result.acceptingConfiguration.get();
		assertEquals(StateId.of("q1"), configuration.state);
		assertEquals(2, configuration.position);
		assertEquals(Symbol.chars("Z"), configuration.stack);
	}

	@Test
	public void testEmptyStackAcceptance(){
		PushdownAutomaton pda = new PushdownAutomatonBuilder()
				.states("q").initial("q", "Z")
				.transition("q", "a", "Z", "q", "A", "Z")
				.transition("q", "a", "A", "q", "A", "A")
				.transition("q", "b", "A", "q")
				.epsilonTransition("q", "Z", "q")
				.build();
		assertEquals(Verdict.ACCEPT, pda.accepts(Symbol.chars("aabb"), 1000, AcceptanceMode.EMPTY_STACK));
		assertEquals(Verdict.REJECT, pda.accepts(Symbol.chars("aab"), 1000, AcceptanceMode.EMPTY_STACK));
		assertEquals(Verdict.REJECT, pda.accepts(Symbol.chars("aabb"), 1000, AcceptanceMode.FINAL_STATE));
	}

	@Test
	public void testInvalidBudget(){
		assertThrows(IllegalArgumentException.class, () -> balancedParentheses().accepts("()", 0));
		assertThrows(IllegalArgumentException.class, () -> balancedParentheses().accepts("()", -3));
	}

	@Nested
	class Validation {

		@Test
		public void testUnknownTargetState(){
			assertThrows(StructuralError.class, () -> new PushdownAutomatonBuilder()
					.states("q0").initial("q0", "Z").transition("q0", "a", "Z", "q1").build());
		}

		@Test
		public void testInitialStackSymbolOutsideOfStackAlphabet(){
			assertThrows(StructuralError.class, () -> new PushdownAutomatonBuilder()
					.states("q0").stackAlphabet("X").initial("q0", "Z").build());
		}

		@Test
		public void testInputOutsideOfDeclaredAlphabet(){
			assertThrows(StructuralError.class, () -> new PushdownAutomatonBuilder()
					.states("q0").inputAlphabet("a").initial("q0", "Z").transition("q0", "b", "Z", "q0", "Z").build());
		}
	}

	@Test
	public void testGraphviz(){
		String dot = balancedParentheses().toGraphvizString();
		assertTrue(dot.contains("q0") && dot.contains("q1"), dot);
	}
}
