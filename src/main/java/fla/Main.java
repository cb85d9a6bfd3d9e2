package fla;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import fla.alphabet.Symbol;
import fla.automata.finite.FiniteAutomaton;
import fla.automata.finite.FiniteAutomatonBuilder;
import fla.automata.pushdown.PushdownAutomaton;
import fla.automata.pushdown.PushdownAutomatonBuilder;
import fla.automata.turing.Move;
import fla.automata.turing.TuringMachine;
import fla.automata.turing.TuringMachineBuilder;
import fla.grammar.CYKRecognizer;
import fla.grammar.Grammar;
import fla.grammar.GrammarBuilder;
import fla.parser.ll.LLParser;
import fla.parser.ll.LLParserTable;
import fla.parser.ll.LLTableConstruction;
import fla.util.BatchRunner;

/**
 * Small demo that runs the classic example analyses and prints their results.
 *
 * Usage: <code>java fla.Main [--dot]</code>, <code>--dot</code> additionally prints the minimized DFA
 * as graphviz DOT.
 */
public class Main {

	private static final Logger LOG = Logger.getLogger("Main");

	public static void main(String[] args) {
		boolean printDot = args.length > 0 && args[0].equals("--dot");
		LOG.fine(() -> "Starting with the default budgets " + Config.pdaStepBudget() + " and " + Config.tmStepBudget());

		FiniteAutomaton nfa = FiniteAutomatonBuilder.nfa()
				.states("q0", "q1").alphabet("a", "b").initial("q0").accepting("q1")
				.transition("q0", "a", "q1").transition("q1", "b", "q1").build();
		List<String> words = Arrays.asList("a", "ab", "abb", "b");
		try (BatchRunner runner = new BatchRunner()) {
			List<Boolean> results = runner.map(words, word -> nfa.accepts(word));
			for (int i = 0; i < words.size(); i++){
				System.out.printf("NFA a b*  accepts %-4s %s%n", words.get(i), results.get(i));
			}
		}

		FiniteAutomaton dfa = FiniteAutomatonBuilder.dfa()
				.states("A", "B", "C", "D").alphabet("a", "b").initial("A").accepting("B", "C")
				.transition("A", "a", "B").transition("A", "b", "D")
				.transition("B", "a", "D").transition("B", "b", "C")
				.transition("C", "a", "D").transition("C", "b", "C")
				.transition("D", "a", "D").transition("D", "b", "D").build();
		FiniteAutomaton minimal = dfa.toMinimalDeterministicVersion();
		System.out.printf("Minimized DFA from %d to %d states, equivalent: %s%n", dfa.getStates().size(),
				minimal.getStates().size(), minimal.isEquivalentTo(nfa));
		if (printDot){
			System.out.println(minimal.toGraphvizString());
		}

		Grammar cnf = new GrammarBuilder()
				.add("S", "A", "B").add("A", "a").add("B", "S", "B").add("B", "b")
				.toGrammar("S");
		CYKRecognizer cyk = new CYKRecognizer(cnf);
		for (String word : Arrays.asList("aabb", "aab")){
			System.out.printf("CYK %s member %-4s %s%n", cnf, word, cyk.member(word));
		}

		PushdownAutomaton pda = balancedParentheses();
		for (String word : Arrays.asList("(())", "(()")){
			System.out.printf("PDA balanced parentheses %-4s %s%n", word, pda.accepts(word, Config.pdaStepBudget()));
		}

		TuringMachine adder = unaryAddition();
		System.out.printf("TM unary addition 111+11 = %s%n",
				adder.compute("111+11", Config.tmStepBudget()).map(Symbol::join).orElse("(no result)"));

		Grammar expressions = new GrammarBuilder()
				.add("E", "E'")
				.add("E'", "T", "E''")
				.add("E''", "+", "T", "E''").add("E''")
				.add("T", "id")
				.toGrammar("E");
		LLTableConstruction construction = LLParserTable.build(expressions);
		if (construction.isLL1()){
			System.out.println(new LLParser(construction.orElseThrow()).parse("id + id").orElseThrow().toPrettyString());
		} else {
			System.out.println(construction);
		}
	}

	/**
	 * Pushes an X per opening parenthesis and pops it per closing one
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
	 * Replaces the plus with a one and erases the last one
	 */
	static TuringMachine unaryAddition(){
		return new TuringMachineBuilder()
				.states("q0", "q1", "q2", "qa").inputAlphabet("1", "+")
				.initial("q0").accept("qa")
				.transition("q0", "1", "q0", "1", Move.RIGHT)
				.transition("q0", "+", "q1", "1", Move.RIGHT)
				.transition("q1", "1", "q1", "1", Move.RIGHT)
				.transition("q1", "_", "q2", "_", Move.LEFT)
				.transition("q2", "1", "qa", "_", Move.LEFT)
				.build();
	}
}
