package fla.automata.finite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Example automata and word enumeration shared by the tests.
 */
class Automata {

	/**
	 * a b*
	 */
	static FiniteAutomaton abStar(){
		return FiniteAutomatonBuilder.nfa()
				.states("q0", "q1").alphabet("a", "b").initial("q0").accepting("q1")
				.transition("q0", "a", "q1").transition("q1", "b", "q1").build();
	}

	/**
	 * a b* with an equivalent pair of accepting states and a dead state
	 */
	static FiniteAutomaton redundantAbStar(){
		return FiniteAutomatonBuilder.dfa()
				.states("A", "B", "C", "D").alphabet("a", "b").initial("A").accepting("B", "C")
				.transition("A", "a", "B").transition("A", "b", "D")
				.transition("B", "a", "D").transition("B", "b", "C")
				.transition("C", "a", "D").transition("C", "b", "C")
				.transition("D", "a", "D").transition("D", "b", "D").build();
	}

	/**
	 * Words over {a, b} whose third last symbol is an a, the classic exponential blow up example
	 */
	static FiniteAutomaton thirdLastIsA(){
		return FiniteAutomatonBuilder.nfa()
				.states("s", "1", "2", "3").alphabet("a", "b").initial("s").accepting("3")
				.transition("s", "a", "s", "1").transition("s", "b", "s")
				.transition("1", "a", "2").transition("1", "b", "2")
				.transition("2", "a", "3").transition("2", "b", "3").build();
	}

	/**
	 * (ab)* | a*, using epsilon transitions including an epsilon cycle
	 */
	static FiniteAutomaton withEpsilonCycle(){
		return FiniteAutomatonBuilder.nfa()
				.states("s", "x0", "x1", "y", "z").alphabet("a", "b").initial("s").accepting("x0", "y")
				.epsilon("s", "x0", "y")
				.transition("x0", "a", "x1").transition("x1", "b", "x0")
				.transition("y", "a", "z").epsilon("z", "y").epsilon("y", "z")
				.build();
	}

	/**
	 * Even number of a's, already minimal and complete
	 */
	static FiniteAutomaton evenAs(){
		return FiniteAutomatonBuilder.dfa()
				.states("e", "o").alphabet("a", "b").initial("e").accepting("e")
				.transition("e", "a", "o").transition("e", "b", "e")
				.transition("o", "a", "e").transition("o", "b", "o").build();
	}

	/**
	 * All words over the alphabet up to the passed length, shortest first
	 */
	static List<String> words(String alphabet, int maxLength){
		List<String> words = new ArrayList<>(Collections.singletonList(""));
		List<String> last = words;
		for (int length = 1; length <= maxLength; length++){
			List<String> next = new ArrayList<>();
			for (String prefix : last){
				for (char c : alphabet.toCharArray()){
					next.add(prefix + c);
				}
			}
			words.addAll(next);
			last = next;
		}
		return words;
	}
}
