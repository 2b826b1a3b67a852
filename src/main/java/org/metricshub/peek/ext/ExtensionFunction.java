package org.metricshub.peek.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Peek
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

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.ext.annotations.PeekExport;
import org.metricshub.peek.ext.annotations.PeekKeywordArgs;

/**
 * A method annotated with {@link PeekExport}, bound to its extension
 * instance and callable as a {@link PeekFunction}.
 */
public final class ExtensionFunction implements PeekFunction {

	private enum Role {
		CONTEXT,
		KEYWORD_ARGS,
		POSITIONAL
	}

	private final String name;
	private final AbstractExtension target;
	private final Method method;
	private final Class<?>[] parameterTypes;
	private final Role[] roles;
	private final boolean varArgs;
	private final int mandatoryParameterCount;
	private final boolean acceptsKeywordArgs;

	ExtensionFunction(String nameParam, AbstractExtension targetParam, Method methodParam) {
		this.name = validateName(nameParam, methodParam);
		this.target = Objects.requireNonNull(targetParam, "target");
		this.method = prepareMethod(methodParam);
		this.parameterTypes = methodParam.getParameterTypes();
		this.varArgs = methodParam.isVarArgs();
		this.roles = inspectParameters(methodParam);
		int positional = 0;
		boolean keywords = false;
		for (Role role : roles) {
			if (role == Role.POSITIONAL) {
				positional++;
			} else if (role == Role.KEYWORD_ARGS) {
				keywords = true;
			}
		}
		this.mandatoryParameterCount = varArgs ? positional - 1 : positional;
		this.acceptsKeywordArgs = keywords;
	}

	private static String validateName(String name, Method method) {
		Objects.requireNonNull(method, "method");
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalStateException(
					"@" + PeekExport.class.getSimpleName() + " on " + method + " must declare a non-empty name");
		}
		return name;
	}

	private static Method prepareMethod(Method method) {
		if (Modifier.isStatic(method.getModifiers())) {
			throw new IllegalStateException(
					"@" + PeekExport.class.getSimpleName() + " does not support static methods: " + method.toGenericString());
		}
		method.setAccessible(true);
		return method;
	}

	private static Role[] inspectParameters(Method method) {
		Class<?>[] types = method.getParameterTypes();
		Role[] result = new Role[types.length];
		for (int idx = 0; idx < types.length; idx++) {
			if (method.getParameters()[idx].isAnnotationPresent(PeekKeywordArgs.class)) {
				if (!Map.class.isAssignableFrom(types[idx])) {
					throw new IllegalStateException(
							"Parameter " + idx + " of " + method + " annotated with @"
									+ PeekKeywordArgs.class.getSimpleName() + " must accept a " + Map.class.getName());
				}
				result[idx] = Role.KEYWORD_ARGS;
			} else if (PeekContext.class.isAssignableFrom(types[idx])) {
				result[idx] = Role.CONTEXT;
			} else {
				result[idx] = Role.POSITIONAL;
			}
		}
		if (method.isVarArgs() && result[types.length - 1] != Role.POSITIONAL) {
			throw new IllegalStateException("Variable arguments of " + method + " must be positional arguments");
		}
		return result;
	}

	/**
	 * @return the name of the function in Peek statements
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the extension declaring the method
	 */
	public AbstractExtension getTarget() {
		return target;
	}

	/**
	 * Returns the minimum number of positional arguments.
	 *
	 * @return required argument count before considering varargs
	 */
	public int getArity() {
		return mandatoryParameterCount;
	}

	public boolean isVarArgs() {
		return varArgs;
	}

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) throws Exception {
		verifyArgCount(args.size());
		if (!acceptsKeywordArgs && !kwargs.isEmpty()) {
			throw new PeekException("Function '" + name + "' does not accept keyword arguments: " + kwargs.keySet());
		}
		Object[] invocationArgs = new Object[parameterTypes.length];
		int next = 0;
		for (int idx = 0; idx < parameterTypes.length; idx++) {
			switch (roles[idx]) {
			case CONTEXT:
				invocationArgs[idx] = context;
				break;
			case KEYWORD_ARGS:
				invocationArgs[idx] = kwargs;
				break;
			default:
				if (varArgs && idx == parameterTypes.length - 1) {
					Class<?> componentType = parameterTypes[idx].getComponentType();
					Object rest = Array.newInstance(componentType, args.size() - next);
					for (int i = 0; next < args.size(); i++, next++) {
						Array.set(rest, i, coerce(args.get(next), componentType, next));
					}
					invocationArgs[idx] = rest;
				} else {
					invocationArgs[idx] = coerce(args.get(next), parameterTypes[idx], next);
					next++;
				}
				break;
			}
		}
		try {
			return method.invoke(target, invocationArgs);
		} catch (IllegalAccessException ex) {
			throw new IllegalStateException("Unable to access extension function method for '" + name + "'", ex);
		} catch (InvocationTargetException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Invocation of extension function '" + name + "' failed", cause);
		}
	}

	/**
	 * Verifies that the provided argument count satisfies the arity constraints.
	 *
	 * @param argCount number of positional arguments the caller supplied
	 * @throws PeekException when the count violates the signature
	 */
	public void verifyArgCount(int argCount) {
		if (varArgs ? argCount < mandatoryParameterCount : argCount != mandatoryParameterCount) {
			throw new PeekException(
					"Function '" + name + "' expects " + (varArgs ? "at least " : "") + mandatoryParameterCount
							+ " argument(s), not " + argCount);
		}
	}

	private Object coerce(Object value, Class<?> type, int position) {
		if (value == null) {
			if (type.isPrimitive()) {
				throw new PeekException("Argument " + position + " passed to '" + name + "' must not be null");
			}
			return null;
		}
		if (value instanceof Number) {
			Number number = (Number) value;
			if (type == int.class || type == Integer.class) {
				return Integer.valueOf(number.intValue());
			}
			if (type == long.class || type == Long.class) {
				return Long.valueOf(number.longValue());
			}
			if (type == double.class || type == Double.class) {
				return Double.valueOf(number.doubleValue());
			}
			if (type == BigInteger.class && !(value instanceof BigInteger)) {
				return BigInteger.valueOf(number.longValue());
			}
		}
		if (type == boolean.class && value instanceof Boolean) {
			return value;
		}
		if (!type.isInstance(value)) {
			throw new PeekException(
					"Argument " + position + " passed to '" + name + "' must be a " + type.getSimpleName() + ", not a "
							+ value.getClass().getSimpleName());
		}
		return value;
	}

	@Override
	public String toString() {
		return "<function " + name + " of " + target.getExtensionName() + ">";
	}
}
