package pin.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * 拼语言列表值（可变，按引用共享）
 */
public final class PinList extends PinValue {

    private final List<PinValue> elements;

    public PinList() {
        this.elements = new ArrayList<PinValue>();
    }

    public PinList(List<PinValue> values) {
        this.elements = new ArrayList<PinValue>(values);
    }

    public List<PinValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public PinValue get(int index) {
        return elements.get(index);
    }

    public void set(int index, PinValue value) {
        elements.set(index, value);
    }

    public void add(PinValue value) {
        elements.add(value);
    }

    @Override
    public String getTypeName() {
        return "列表";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>();
        for (PinValue v : elements) {
            result.add(v.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).repr());
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public boolean equals(PinValue other) {
        if (!(other instanceof PinList)) return false;
        PinList otherList = (PinList) other;
        if (this.elements.size() != otherList.elements.size()) return false;
        for (int i = 0; i < elements.size(); i++) {
            if (!elements.get(i).equals(otherList.elements.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
