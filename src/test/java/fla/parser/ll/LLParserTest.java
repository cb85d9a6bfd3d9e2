package fla.parser.ll;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import fla.FLAException;
import fla.alphabet.Symbol;
import fla.grammar.*;

import static fla.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class LLParserTest {

	private static LLParser parser(Grammar grammar){
		return new LLParser(LLParserTable.build(grammar).orElseThrow());
	}

	@Nested
	class Table {

		@Test
		public void testExpressionsAreLL1(){
			LLTableConstruction construction = LLParserTable.build(expressions());
			assertTrue(construction.isLL1(), construction.toString());
			assertTrue(construction.getConflicts().isEmpty());
			LLParserTable table = construction.getTable().get();
			assertEquals(5, table.size());
			assertEquals("E'' → ε", table.get(new NonTerminal("E''"), Terminal.EOF).get().toString());
			assertEquals("E'' → + T E''", table.get(new NonTerminal("E''"), Terminal.of("+")).get().toString());
			assertFalse(table.get(new NonTerminal("T"), Terminal.of("+")).isPresent());
			assertEquals(terminals("+", "$"), new HashSet<>(table.expectedTerminals(new NonTerminal("E''"))));
		}

		@Test
		public void testAmbiguousGrammarConflicts(){
			LLTableConstruction construction = LLParserTable.build(ambiguous());
			assertFalse(construction.isLL1());
			assertFalse(construction.getTable().isPresent());
			assertEquals(1, construction.getConflicts().size());
			Conflict conflict = construction.getConflicts().get(0);
			assertEquals(new NonTerminal("S"), conflict.nonTerminal);
			assertEquals(Terminal.of("a"), conflict.lookahead);
			assertEquals("S → A", conflict.first.toString());
			assertEquals("S → B", conflict.second.toString());
			assertThrows(FLAException.class, construction::orElseThrow);
		}

		@Test
		public void testFirstFollowConflict(){
			Grammar grammar = new GrammarBuilder().add("S", "A", "a").add("A", "a").add("A").toGrammar("S");
			List<Conflict> conflicts = LLParserTable.build(grammar).getConflicts();
			assertEquals(1, conflicts.size());
			assertEquals(new NonTerminal("A"), conflicts.get(0).nonTerminal);
		}

		@Test
		public void testEveryConflictIsReported(){
			Grammar grammar = new GrammarBuilder()
					.add("S", "a").add("S", "a", "b").add("S", "c").add("S", "c", "d")
					.toGrammar("S");
			assertEquals(2, LLParserTable.build(grammar).getConflicts().size());
		}

		@Test
		public void testLeftRecursiveGrammarConflicts(){
			Grammar grammar = new GrammarBuilder().add("E", "E", "+", "T").add("E", "T").add("T", "id").toGrammar("E");
			assertFalse(LLParserTable.build(grammar).isLL1());
		}
	}

	@Nested
	class Parsing {

		@Test
		public void testSum(){
			ParseResult result = parser(expressions()).parse("id + id");
			assertTrue(result.isSuccess(), result.toString());
			ParseTree tree = result.orElseThrow();
			assertEquals("E(E'(T(id) E''(+ T(id) E''(ε))))", tree.toString());
			assertEquals(Symbol.words("id + id"), tree.yield());
			assertEquals(Arrays.asList("E → E'", "E' → T E''", "T → id", "E'' → + T E''", "T → id", "E'' → ε"),
					toStrings(tree.leftmostDerivation()));
		}

		@Test
		public void testTreeStructure(){
			ParseTree tree = parser(expressions()).parse("id").orElseThrow();
			ParseTree.Node root = tree.getRoot();
			assertEquals(new NonTerminal("E"), root.symbol);
			assertEquals(-1, root.parent);
			assertEquals(6, tree.size());
			for (ParseTree.Node node : tree.getNodes()){
				for (ParseTree.Node child : tree.children(node)){
					assertEquals(node.index, child.parent);
				}
				assertEquals(node.isLeaf(), !node.getProduction().isPresent());
			}
			assertEquals("E\n  E'\n    T\n      id\n    E''\n      ε", tree.toPrettyString());
		}

		@Test
		public void testLongInput(){
			StringBuilder input = new StringBuilder("id");
			for (int i = 0; i < 2000; i++){
				input.append(" + id");
			}
			ParseResult result = parser(expressions()).parse(input.toString());
			assertEquals(4001, result.orElseThrow().yield().size());
		}

		@ParameterizedTest
		@CsvSource({
				"'id +', 2, $, id",
				"'id id', 1, id, + $",
				"'+ id', 0, +, id",
				"'', 0, $, id"
		})
		public void testSyntaxErrors(String input, int position, String found, String expected){
			ParseResult result = parser(expressions()).parse(input);
			assertFalse(result.isSuccess());
			assertFalse(result.getTree().isPresent());
			SyntaxError error = result.getError().get();
			assertEquals(position, error.position);
			assertEquals(found, error.found.toString());
			assertEquals(terminals(expected.split(" ")), new HashSet<>(error.expected));
			assertThrows(FLAException.class, result::orElseThrow);
		}

		@Test
		public void testUnknownTerminal(){
			SyntaxError error = parser(expressions()).parse("id * id").getError().get();
			assertEquals(1, error.position);
			assertEquals(Terminal.of("*"), error.found);
			assertEquals("Unknown terminal", error.message);
		}

		@Test
		public void testEarlierSyntaxErrorBeforeUnknownTerminal(){
			SyntaxError error = parser(expressions()).parse("+ id * id").getError().get();
			assertEquals(0, error.position);
			assertEquals(Terminal.of("+"), error.found);
			assertNotEquals("Unknown terminal", error.message);
		}

		@Test
		public void testInputRemains(){
			Grammar grammar = new GrammarBuilder().add("S", "a").toGrammar("S");
			SyntaxError error = parser(grammar).parse("a a").getError().get();
			assertEquals(1, error.position);
			assertEquals(terminals("$"), new HashSet<>(error.expected));
		}

		private List<String> toStrings(List<Production> productions){
			List<String> ret = new ArrayList<>();
			for (Production production : productions){
				ret.add(production.toString());
			}
			return ret;
		}
	}
}
