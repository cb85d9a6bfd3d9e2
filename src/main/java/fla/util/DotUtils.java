package fla.util;

import java.util.*;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Helps to create graphviz graphs of automata.
 */
public class DotUtils {

	/**
	 * Name of the invisible node that points to the initial state
	 */
	public static final String INITIAL_MARKER = "__initial";

	private final MutableGraph graph;

	private final Map<String, MutableNode> nodes = new LinkedHashMap<>();

	/**
	 * Labels per (source, target) pair, edges between the same states are merged
	 */
	private final Map<Pair<String, String>, List<String>> edgeLabels = new LinkedHashMap<>();

	public DotUtils(String name) {
		this.graph = mutGraph(name).setDirected(true);
		graph.graphAttrs().add(attr("rankdir", "LR"));
	}

	public DotUtils state(String name, boolean accepting){
		MutableNode node = mutNode(name).add(accepting ? Shape.DOUBLE_CIRCLE : Shape.CIRCLE);
		nodes.put(name, node);
		return this;
	}

	public DotUtils initial(String name){
		MutableNode marker = mutNode(INITIAL_MARKER).add(Shape.POINT);
		nodes.put(INITIAL_MARKER, marker);
		edgeLabels.put(new Pair<>(INITIAL_MARKER, name), new ArrayList<>());
		return this;
	}

	public DotUtils edge(String from, String to, String label){
		edgeLabels.computeIfAbsent(new Pair<>(from, to), p -> new ArrayList<>()).add(label);
		return this;
	}

	public MutableGraph toGraph(){
		for (Map.Entry<Pair<String, String>, List<String>> entry : edgeLabels.entrySet()){
			MutableNode source = nodes.get(entry.getKey().first);
			MutableNode target = nodes.get(entry.getKey().second);
			if (entry.getValue().isEmpty()){
				source.addLink(target);
			} else {
				source.addLink(to(target).with(Label.of(String.join(", ", entry.getValue()))));
			}
		}
		for (MutableNode node : nodes.values()){
			graph.add(node);
		}
		return graph;
	}
}
