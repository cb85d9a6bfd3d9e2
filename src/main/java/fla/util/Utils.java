package fla.util;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	public static <T> String join(Collection<T> objs, String joiner){
		return objs.stream().map(Object::toString).collect(Collectors.joining(joiner));
	}

	/**
	 * Deep unmodifiable copy of a map of sets.
	 */
	public static <K, V> Map<K, Set<V>> unmodifiableCopy(Map<K, ? extends Set<V>> map){
		Map<K, Set<V>> ret = new LinkedHashMap<>();
		for (Map.Entry<K, ? extends Set<V>> entry : map.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}
		return Collections.unmodifiableMap(ret);
	}

	public static void checkBudget(int stepBudget){
		if (stepBudget <= 0){
			throw new IllegalArgumentException("Step budget has to be positive, got " + stepBudget);
		}
	}
}
