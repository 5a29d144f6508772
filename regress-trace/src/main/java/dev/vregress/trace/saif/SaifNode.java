package dev.vregress.trace.saif;

import com.google.common.collect.ImmutableList;

/**
 * Node of the parenthesized syntax tree a SAIF file is made of.
 */
sealed interface SaifNode {
	int line();

	record Atom(String text, int line) implements SaifNode {}

	record Group(ImmutableList<SaifNode> items, int line) implements SaifNode {
		String keyword() {
			if(!items.isEmpty() && items.get(0) instanceof Atom atom) {
				return atom.text();
			}
			return "";
		}
	}
}
