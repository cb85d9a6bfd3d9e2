package fla.parser.ll;

import java.io.Serializable;
import java.util.*;

import fla.alphabet.Symbol;
import fla.grammar.Epsilon;
import fla.grammar.GrammarSymbol;
import fla.grammar.NonTerminal;
import fla.grammar.Production;
import fla.grammar.Terminal;

/**
 * Immutable parse tree. The nodes are stored in a list and reference each other by their index,
 * the root has the index 0.
 */
public final class ParseTree implements Serializable {

	public static final class Node implements Serializable {

		public final int index;

		/**
		 * Non terminal for inner nodes, terminal or ε for leaves
		 */
		public final GrammarSymbol symbol;

		/**
		 * Index of the parent node, -1 for the root
		 */
		public final int parent;

		public final List<Integer> children;

		private final Production production;

		private Node(int index, GrammarSymbol symbol, int parent, List<Integer> children, Production production) {
			this.index = index;
			this.symbol = symbol;
			this.parent = parent;
			this.children = Collections.unmodifiableList(new ArrayList<>(children));
			this.production = production;
		}

		/**
		 * The production expanded at this node, empty for leaves
		 */
		public Optional<Production> getProduction() {
			return Optional.ofNullable(production);
		}

		public boolean isLeaf(){
			return children.isEmpty();
		}

		@Override
		public String toString() {
			return symbol.toString();
		}
	}

	private final List<Node> nodes;

	private ParseTree(List<Node> nodes) {
		this.nodes = Collections.unmodifiableList(nodes);
	}

	public Node getRoot(){
		return nodes.get(0);
	}

	public Node getNode(int index){
		return nodes.get(index);
	}

	public List<Node> getNodes() {
		return nodes;
	}

	public List<Node> children(Node node){
		List<Node> ret = new ArrayList<>();
		for (int child : node.children){
			ret.add(nodes.get(child));
		}
		return ret;
	}

	public int size(){
		return nodes.size();
	}

	/**
	 * Productions in the order of a leftmost derivation
	 */
	public List<Production> leftmostDerivation(){
		List<Production> ret = new ArrayList<>();
		for (Node node : preOrder()){
			node.getProduction().ifPresent(ret::add);
		}
		return ret;
	}

	/**
	 * The terminals at the leaves from left to right, i.e. the parsed word
	 */
	public List<Symbol> yield(){
		List<Symbol> ret = new ArrayList<>();
		for (Node node : preOrder()){
			if (node.symbol instanceof Terminal){
				ret.add(((Terminal) node.symbol).symbol);
			}
		}
		return ret;
	}

	private List<Node> preOrder(){
		List<Node> ret = new ArrayList<>();
		Deque<Integer> stack = new ArrayDeque<>();
		stack.push(0);
		while (!stack.isEmpty()){
			Node node = nodes.get(stack.pop());
			ret.add(node);
			for (int i = node.children.size() - 1; i >= 0; i--){
				stack.push(node.children.get(i));
			}
		}
		return ret;
	}

	/**
	 * One node per line, children indented by two spaces
	 */
	public String toPrettyString(){
		StringBuilder builder = new StringBuilder();
		Deque<int[]> stack = new ArrayDeque<>();
		stack.push(new int[]{0, 0});
		while (!stack.isEmpty()){
			int[] entry = stack.pop();
			Node node = nodes.get(entry[0]);
			if (builder.length() > 0){
				builder.append("\n");
			}
			for (int i = 0; i < entry[1]; i++){
				builder.append("  ");
			}
			builder.append(node.symbol);
			for (int i = node.children.size() - 1; i >= 0; i--){
				stack.push(new int[]{node.children.get(i), entry[1] + 1});
			}
		}
		return builder.toString();
	}

	/**
	 * Bracketed form, e.g. {@code S(a S(ε) b)}
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		Deque<Object> stack = new ArrayDeque<>();
		stack.push(0);
		while (!stack.isEmpty()){
			Object top = stack.pop();
			if (top instanceof String){
				builder.append(top);
				continue;
			}
			Node node = nodes.get((Integer) top);
			builder.append(node.symbol);
			if (!node.isLeaf()){
				builder.append("(");
				stack.push(")");
				for (int i = node.children.size() - 1; i >= 0; i--){
					stack.push(node.children.get(i));
					if (i > 0){
						stack.push(" ");
					}
				}
			}
		}
		return builder.toString();
	}

	/**
	 * Collects the nodes while parsing, the tree grows by expanding leaves
	 */
	static class Builder {

		private final List<GrammarSymbol> symbols = new ArrayList<>();
		private final List<Integer> parents = new ArrayList<>();
		private final List<List<Integer>> children = new ArrayList<>();
		private final List<Production> productions = new ArrayList<>();

		Builder(NonTerminal start){
			add(start, -1);
		}

		private int add(GrammarSymbol symbol, int parent){
			int index = symbols.size();
			symbols.add(symbol);
			parents.add(parent);
			children.add(new ArrayList<>());
			productions.add(null);
			if (parent != -1){
				children.get(parent).add(index);
			}
			return index;
		}

		/**
		 * Adds a child per right hand side symbol (or a single ε leaf)
		 *
		 * @return indexes of the new children
		 */
		List<Integer> expand(int index, Production production){
			productions.set(index, production);
			List<Integer> ret = new ArrayList<>();
			if (production.isEpsilonProduction()){
				add(Epsilon.EPSILON, index);
				return ret;
			}
			for (GrammarSymbol symbol : production.right){
				ret.add(add(symbol, index));
			}
			return ret;
		}

		ParseTree build(){
			List<Node> nodes = new ArrayList<>();
			for (int i = 0; i < symbols.size(); i++){
				nodes.add(new Node(i, symbols.get(i), parents.get(i), children.get(i), productions.get(i)));
			}
			return new ParseTree(nodes);
		}
	}
}
