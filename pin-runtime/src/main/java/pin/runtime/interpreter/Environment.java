package pin.runtime.interpreter;

import pin.runtime.PinValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 变量表：一次运行只有一个，没有作用域嵌套，任何赋值都直接覆盖。
 */
public final class Environment {

    private final Map<String, PinValue> values = new LinkedHashMap<String, PinValue>();

    public void define(String name, PinValue value) {
        values.put(name, value);
    }

    /** 未定义时返回 null */
    public PinValue get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
