package evalexpr.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 列表值（有序序列）。
 *
 * <p>实例不可变：{@link #append(ExprValue)} 返回追加了元素的新列表，
 * 调用参数列表在构造过程中因此不会被别处观察到修改。</p>
 */
public final class ExprList extends ExprValue implements Iterable<ExprValue> {

    private static final ExprList EMPTY = new ExprList(Collections.<ExprValue>emptyList());

    private final List<ExprValue> elements;

    private ExprList(List<ExprValue> elements) {
        this.elements = elements;
    }

    public static ExprList empty() {
        return EMPTY;
    }

    public static ExprList of(List<ExprValue> values) {
        return new ExprList(Collections.unmodifiableList(new ArrayList<ExprValue>(values)));
    }

    public static ExprList of(ExprValue... values) {
        List<ExprValue> list = new ArrayList<ExprValue>(values.length);
        Collections.addAll(list, values);
        return new ExprList(Collections.unmodifiableList(list));
    }

    /**
     * 返回在末尾追加 {@code element} 的新列表
     */
    public ExprList append(ExprValue element) {
        List<ExprValue> copy = new ArrayList<ExprValue>(elements.size() + 1);
        copy.addAll(elements);
        copy.add(element);
        return new ExprList(Collections.unmodifiableList(copy));
    }

    /** 只读视图 */
    public List<ExprValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public ExprValue get(int index) {
        return elements.get(index);
    }

    @Override
    public Iterator<ExprValue> iterator() {
        return elements.iterator();
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    public boolean valueEquals(ExprValue other) {
        if (!(other instanceof ExprList)) return false;
        ExprList otherList = (ExprList) other;
        if (elements.size() != otherList.elements.size()) return false;
        for (int i = 0; i < elements.size(); i++) {
            if (!elements.get(i).valueEquals(otherList.elements.get(i))) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toString());
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExprList && ((ExprList) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
