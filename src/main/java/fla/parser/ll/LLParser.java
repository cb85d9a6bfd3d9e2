package fla.parser.ll;

import java.util.*;

import fla.alphabet.Symbol;
import fla.grammar.*;

/**
 * Table driven LL(1) parser. The stack holds grammar symbols together with the index of their
 * parse tree node and starts as [start, $].
 */
public class LLParser {

	private final Grammar grammar;
	private final LLParserTable table;

	public LLParser(LLParserTable table){
		this.grammar = table.grammar;
		this.table = table;
	}

	private static class StackFrame {
		final GrammarSymbol symbol;
		final int node;

		StackFrame(GrammarSymbol symbol, int node) {
			this.symbol = symbol;
			this.node = node;
		}
	}

	/**
	 * Parses the passed terminals, never throws on invalid input.
	 *
	 * @param input terminal symbols without end of input marker
	 * @return parse tree or the first syntax error
	 */
	public ParseResult parse(List<Symbol> input){
		List<Terminal> tokens = new ArrayList<>();
		for (Symbol symbol : input){
			tokens.add(new Terminal(symbol));
		}
		ParseTree.Builder tree = new ParseTree.Builder(grammar.getStart());
		Deque<StackFrame> stack = new ArrayDeque<>();
		stack.push(new StackFrame(Terminal.EOF, -1));
		stack.push(new StackFrame(grammar.getStart(), 0));
		int position = 0;
		while (true){
			Terminal current = position < tokens.size() ? tokens.get(position) : Terminal.EOF;
			if (position < tokens.size() && !grammar.getTerminals().contains(current)){
				return ParseResult.failure(new SyntaxError(position, current, grammar.getTerminals(), "Unknown terminal"));
			}
			StackFrame top = stack.pop();
			if (top.symbol instanceof Terminal){
				Terminal expected = (Terminal) top.symbol;
				if (!expected.equals(current)){
					String message = expected.isEOF() ? "Input remains after the start symbol has been matched"
							: "Unexpected " + current;
					return ParseResult.failure(new SyntaxError(position, current,
							new TreeSet<>(Collections.singleton(expected)), message));
				}
				if (expected.isEOF()){
					ParseTree result = tree.build();
					LLParserTable.LOG.finer(() -> "Parsed " + result);
					return ParseResult.success(result);
				}
				position++;
			} else {
				NonTerminal nonTerminal = (NonTerminal) top.symbol;
				Optional<Production> production = table.get(nonTerminal, current);
				if (!production.isPresent()){
					return ParseResult.failure(new SyntaxError(position, current, table.expectedTerminals(nonTerminal),
							String.format("Unexpected %s while expanding %s", current, nonTerminal)));
				}
				List<Integer> children = tree.expand(top.node, production.get());
				for (int i = children.size() - 1; i >= 0; i--){
					stack.push(new StackFrame(production.get().right.get(i), children.get(i)));
				}
			}
		}
	}

	/**
	 * Parses whitespace separated terminals
	 */
	public ParseResult parse(String input){
		return parse(Symbol.words(input));
	}
}
