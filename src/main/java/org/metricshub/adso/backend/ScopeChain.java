package org.metricshub.adso.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Adso
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.adso.jrt.UnboundNameException;

/**
 * Chain of binding tables used for name resolution.
 * <p>
 * Scopes live in an arena and refer to their parent by index. Scopes are
 * pushed and popped in LIFO order, so the current scope is always the last
 * one of the arena; its parent, used for lookups, may be any older scope.
 * Index 0 is the root scope, which is never popped.
 */
class ScopeChain {

	static final int ROOT = 0;

	private static final int NO_PARENT = -1;

	private static final class Scope {
		private final Map<String, Binding> bindings = new HashMap<String, Binding>();
		private final int parent;

		private Scope(int parent) {
			this.parent = parent;
		}
	}

	private final List<Scope> scopes = new ArrayList<Scope>();

	ScopeChain() {
		scopes.add(new Scope(NO_PARENT));
	}

	private int current() {
		return scopes.size() - 1;
	}

	/**
	 * Makes a new scope whose parent is the current scope the current one.
	 */
	void pushChild() {
		scopes.add(new Scope(current()));
	}

	/**
	 * Makes a new scope whose parent is the root scope the current one, so that
	 * a function body does not see the bindings of its caller.
	 */
	void pushCallScope() {
		scopes.add(new Scope(ROOT));
	}

	/**
	 * Discards the current scope and makes the scope that was current before
	 * its push current again.
	 *
	 * @throws IllegalStateException on an attempt to pop the root scope
	 */
	void pop() {
		if (current() == ROOT) {
			throw new IllegalStateException("Cannot pop the root scope");
		}
		scopes.remove(current());
	}

	/**
	 * Looks a name up in the current scope, then in each of its ancestors.
	 *
	 * @param name the name to resolve
	 * @param line line of the use of the name, reported on failure
	 * @return the first binding found
	 * @throws UnboundNameException if no scope of the chain binds the name
	 */
	Binding lookup(String name, int line) {
		for (int idx = current(); idx != NO_PARENT; idx = scopes.get(idx).parent) {
			Binding binding = scopes.get(idx).bindings.get(name);
			if (binding != null) {
				return binding;
			}
		}
		throw new UnboundNameException(line, name);
	}

	/**
	 * Binds a name in the current scope only, replacing a previous binding of
	 * that scope. Bindings of the ancestors are left untouched.
	 */
	void define(String name, Binding binding) {
		scopes.get(current()).bindings.put(name, binding);
	}

	/**
	 * @return the number of scopes pushed above the root scope
	 */
	int depth() {
		return current();
	}
}
