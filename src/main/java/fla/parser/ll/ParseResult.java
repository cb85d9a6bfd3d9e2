package fla.parser.ll;

import java.util.Optional;

import fla.FLAException;

/**
 * Either a parse tree or a syntax error.
 */
public final class ParseResult {

	private final ParseTree tree;
	private final SyntaxError error;

	private ParseResult(ParseTree tree, SyntaxError error) {
		this.tree = tree;
		this.error = error;
	}

	public static ParseResult success(ParseTree tree){
		return new ParseResult(tree, null);
	}

	public static ParseResult failure(SyntaxError error){
		return new ParseResult(null, error);
	}

	public boolean isSuccess(){
		return tree != null;
	}

	public Optional<ParseTree> getTree() {
		return Optional.ofNullable(tree);
	}

	public Optional<SyntaxError> getError() {
		return Optional.ofNullable(error);
	}

	/**
	 * @throws FLAException if parsing failed
	 */
	public ParseTree orElseThrow(){
		if (tree == null){
			throw new FLAException(error.toString());
		}
		return tree;
	}

	@Override
	public String toString() {
		return isSuccess() ? tree.toString() : error.toString();
	}
}
