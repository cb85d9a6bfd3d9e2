package fla.grammar;

/**
 * Element of a FIRST set
 */
public abstract class TerminalOrEpsilon extends GrammarSymbol {
}
