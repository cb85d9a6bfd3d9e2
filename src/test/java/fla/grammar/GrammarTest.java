package fla.grammar;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import fla.StructuralError;

import static fla.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	private static NonTerminal nt(String name){
		return new NonTerminal(name);
	}

	@Nested
	class Nullable {

		@Test
		public void testExpressions(){
			assertEquals(nonTerminals("E''"), expressions().calculateEpsilonable());
		}

		@Test
		public void testTransitive(){
			assertEquals(nonTerminals("S", "A", "B"), nullables().calculateEpsilonable());
		}

		@Test
		public void testNoNullables(){
			assertEquals(nonTerminals(), chomsky().calculateEpsilonable());
		}

		@Test
		public void testSnapshotsGrowMonotonically(){
			List<Set<NonTerminal>> snapshots = new ArrayList<>();
			Set<NonTerminal> result = nullables().calculateEpsilonable((round, snapshot) -> snapshots.add(snapshot));
			assertTrue(snapshots.size() >= 2);
			for (int i = 1; i < snapshots.size(); i++){
				assertTrue(snapshots.get(i).containsAll(snapshots.get(i - 1)), "round " + (i + 1));
			}
			assertEquals(snapshots.get(snapshots.size() - 1), snapshots.get(snapshots.size() - 2));
			assertEquals(result, snapshots.get(snapshots.size() - 1));
		}
	}

	@Nested
	class First {

		@Test
		public void testExpressions(){
			Map<NonTerminal, Set<TerminalOrEpsilon>> first = expressions().calculateFirst1Set();
			assertEquals(first("id"), first.get(nt("E")));
			assertEquals(first("id"), first.get(nt("E'")));
			assertEquals(first("+", "ε"), first.get(nt("E''")));
			assertEquals(first("id"), first.get(nt("T")));
		}

		@Test
		public void testPropagatesOverNullablePrefixes(){
			Map<NonTerminal, Set<TerminalOrEpsilon>> first = nullables().calculateFirst1Set();
			assertEquals(first("a", "b", "c", "ε"), first.get(nt("S")));
			assertEquals(first("a", "ε"), first.get(nt("A")));
			assertEquals(first("b", "ε"), first.get(nt("B")));
		}

		@Test
		public void testTerm(){
			Grammar grammar = nullables();
			assertEquals(first("a", "b", "c"), grammar.calculateFirst1SetForTerm(
					Arrays.asList(nt("A"), nt("B"), Terminal.of("c"))));
			assertEquals(first("a", "b", "ε"), grammar.calculateFirst1SetForTerm(Arrays.asList(nt("A"), nt("B"))));
			assertEquals(first("ε"), grammar.calculateFirst1SetForTerm(Collections.emptyList()));
		}

		@Test
		public void testSnapshotsGrowMonotonically(){
			List<Map<NonTerminal, Set<TerminalOrEpsilon>>> snapshots = new ArrayList<>();
			Grammar grammar = nullables();
			grammar.calculateFirst1Set(grammar.calculateEpsilonable(), (round, snapshot) -> snapshots.add(snapshot));
			assertTrue(snapshots.size() >= 2);
			for (int i = 1; i < snapshots.size(); i++){
				for (NonTerminal nonTerminal : grammar.getNonTerminals()){
					assertTrue(snapshots.get(i).get(nonTerminal).containsAll(snapshots.get(i - 1).get(nonTerminal)));
				}
			}
			assertEquals(snapshots.get(snapshots.size() - 1), snapshots.get(snapshots.size() - 2));
		}
	}

	@Nested
	class Follow {

		@Test
		public void testExpressions(){
			Map<NonTerminal, Set<Terminal>> follow = expressions().calculateFollow1Set();
			assertEquals(terminals("$"), follow.get(nt("E")));
			assertEquals(terminals("$"), follow.get(nt("E'")));
			assertEquals(terminals("$"), follow.get(nt("E''")));
			assertEquals(terminals("+", "$"), follow.get(nt("T")));
		}

		@Test
		public void testNullableSuffix(){
			Map<NonTerminal, Set<Terminal>> follow = nullables().calculateFollow1Set();
			assertEquals(terminals("$"), follow.get(nt("S")));
			assertEquals(terminals("b", "c"), follow.get(nt("A")));
			assertEquals(terminals("c", "$"), follow.get(nt("B")));
		}

		@Test
		public void testStartAlwaysContainsEndMarker(){
			for (Grammar grammar : Arrays.asList(expressions(), ambiguous(), chomsky(), nullables())){
				assertTrue(grammar.calculateFollow1Set().get(grammar.getStart()).contains(Terminal.EOF));
			}
		}

		@Test
		public void testSnapshotsGrowMonotonically(){
			Grammar grammar = chomsky();
			Set<NonTerminal> epsilonable = grammar.calculateEpsilonable();
			List<Map<NonTerminal, Set<Terminal>>> snapshots = new ArrayList<>();
			grammar.calculateFollow1Set(grammar.calculateFirst1Set(), epsilonable, (round, snapshot) -> snapshots.add(snapshot));
			for (int i = 1; i < snapshots.size(); i++){
				for (NonTerminal nonTerminal : grammar.getNonTerminals()){
					assertTrue(snapshots.get(i).get(nonTerminal).containsAll(snapshots.get(i - 1).get(nonTerminal)));
				}
			}
			assertEquals(terminals("a", "b", "$"), snapshots.get(snapshots.size() - 1).get(nt("S")));
		}
	}

	@Nested
	class Structure {

		@Test
		public void testUndeclaredTerminal(){
			assertThrows(StructuralError.class, () -> new GrammarBuilder().terminals("a")
					.add("S", "a", "b").toGrammar("S"));
		}

		@Test
		public void testUndeclaredNonTerminal(){
			Production production = new Production(0, nt("S"), Collections.singletonList(nt("X")));
			assertThrows(StructuralError.class, () -> new Grammar(nonTerminals("S"), Collections.emptySet(),
					Collections.singletonList(production), nt("S")));
		}

		@Test
		public void testUnknownStart(){
			assertThrows(StructuralError.class, () -> new GrammarBuilder().add("S", "a").toGrammar("X"));
		}

		@Test
		public void testEndMarkerIsReserved(){
			assertThrows(StructuralError.class, () -> new GrammarBuilder().add("S", "a", "$").toGrammar("S"));
		}

		@Test
		public void testSymbolUsedAsTerminalAndNonTerminal(){
			assertThrows(StructuralError.class, () -> new GrammarBuilder().terminals("S").add("S", "a").toGrammar("S"));
		}

		@Test
		public void testDuplicateProductionsAreDropped(){
			Grammar grammar = new GrammarBuilder().add("S", "a").add("S", "b").add("S", "a").toGrammar("S");
			assertEquals(2, grammar.getProductions().size());
			assertEquals(1, grammar.getProductionForId(1).id);
			assertEquals("S → b", grammar.getProductionForId(1).toString());
		}

		@Test
		public void testDeclaredNonTerminalWithoutProductions(){
			Grammar grammar = new GrammarBuilder().nonTerminals("X").add("S", "a", "X").toGrammar("S");
			assertTrue(grammar.getNonTerminal("X").isPresent());
			assertEquals(terminals("a"), new HashSet<>(grammar.getTerminals()));
			assertFalse(grammar.calculateEpsilonable().contains(nt("X")));
		}

		@Test
		public void testAddWords(){
			Grammar grammar = new GrammarBuilder().addWords("S", "( S )").addWords("S", "").toGrammar("S");
			assertEquals("S → ( S ); S → ε", grammar.toString());
		}

		@Test
		public void testReachableNonTerminals(){
			Grammar grammar = new GrammarBuilder().add("S", "A").add("A", "a").add("U", "b").toGrammar("S");
			assertEquals(Arrays.asList(nt("S"), nt("A")), new ArrayList<>(grammar.calculateReachableNonTerminals()));
		}

		@Test
		public void testLeftRecursion(){
			Grammar direct = new GrammarBuilder().add("E", "E", "+", "T").add("E", "T").add("T", "id").toGrammar("E");
			assertEquals(nonTerminals("E"), new HashSet<>(direct.calculateLeftRecursiveNonTerminals()));
			Grammar indirect = new GrammarBuilder().add("A", "B", "x").add("B", "A", "y").add("B", "z").toGrammar("A");
			assertEquals(nonTerminals("A", "B"), new HashSet<>(indirect.calculateLeftRecursiveNonTerminals()));
			Grammar hidden = new GrammarBuilder().add("A", "C", "A", "x").add("A", "y").add("C", "c").add("C")
					.toGrammar("A");
			assertEquals(nonTerminals("A"), new HashSet<>(hidden.calculateLeftRecursiveNonTerminals()));
			assertTrue(expressions().calculateLeftRecursiveNonTerminals().isEmpty());
		}

		@Test
		public void testChomskyNormalForm(){
			assertTrue(chomsky().isInChomskyNormalForm());
			assertFalse(expressions().isInChomskyNormalForm());
			assertFalse(nullables().isInChomskyNormalForm());
			assertTrue(new GrammarBuilder().add("S", "a").add("S").toGrammar("S").isInChomskyNormalForm());
			assertFalse(new GrammarBuilder().add("S", "S", "S").add("S", "a").add("S").toGrammar("S")
					.isInChomskyNormalForm());
		}

		@Test
		public void testLongDescription(){
			String description = chomsky().longDescription();
			assertTrue(description.startsWith("Start non terminal: S"), description);
			assertTrue(description.contains("B → S B"), description);
		}
	}
}
