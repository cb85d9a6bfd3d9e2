package fla.automata.finite;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Collects checks on a finite automaton and runs them together.
 */
public class AutomatonMatcher {

	private final FiniteAutomaton automaton;
	private final List<Executable> testers = new ArrayList<>();

	public AutomatonMatcher(FiniteAutomaton automaton) {
		this.automaton = automaton;
	}

	public static AutomatonMatcher match(FiniteAutomaton automaton){
		return new AutomatonMatcher(automaton);
	}

	public AutomatonMatcher accepts(String... words){
		for (String word : words){
			testers.add(() -> assertTrue(automaton.accepts(word), String.format("Should accept \"%s\": %s", word, automaton)));
		}
		return this;
	}

	public AutomatonMatcher rejects(String... words){
		for (String word : words){
			testers.add(() -> assertFalse(automaton.accepts(word), String.format("Should reject \"%s\": %s", word, automaton)));
		}
		return this;
	}

	public AutomatonMatcher states(int count){
		testers.add(() -> assertEquals(count, automaton.getStates().size(), "Number of states of " + automaton));
		return this;
	}

	public AutomatonMatcher deterministic(){
		testers.add(() -> assertTrue(automaton.isDeterministic, "Should be deterministic: " + automaton));
		return this;
	}

	public AutomatonMatcher equivalentTo(FiniteAutomaton other){
		testers.add(() -> assertEquals("", automaton.findDistinguishingWord(other)
				.map(fla.alphabet.Symbol::join).map(w -> "distinguished by \"" + w + "\"").orElse("")));
		return this;
	}

	public void run(){
		assertAll(testers.toArray(new Executable[0]));
	}
}
