package evalexpr.runtime.interpreter;

import evalexpr.runtime.ExprValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 运行时环境：变量名 → 值的单一全局映射
 *
 * <p>语言没有词法作用域和嵌套帧。一个实例只属于一次执行（或一个 REPL 会话），
 * 由调用方显式传给 {@link VirtualMachine#run}。</p>
 */
public final class Environment {

    private final Map<String, ExprValue> bindings = new LinkedHashMap<String, ExprValue>();
    private Map<String, ExprValue> builtins = Collections.emptyMap();

    /**
     * 创建已注册内置函数和常量的环境
     */
    public static Environment withBuiltins() {
        Environment env = new Environment();
        Builtins.register(env);
        env.sealBuiltins();
        return env;
    }

    /**
     * 绑定（或重新绑定）变量
     */
    public void define(String name, ExprValue value) {
        bindings.put(name, value);
    }

    /**
     * 查找变量，未绑定返回 null
     */
    public ExprValue lookup(String name) {
        return bindings.get(name);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public int size() {
        return bindings.size();
    }

    /**
     * 标记当前已注册的绑定为内置绑定
     */
    void sealBuiltins() {
        this.builtins = new LinkedHashMap<String, ExprValue>(bindings);
    }

    /**
     * 用户定义的绑定（按名称排序的快照）。内置绑定被重新赋值后也算作用户绑定。
     */
    public Map<String, ExprValue> getUserBindings() {
        Map<String, ExprValue> result = new TreeMap<String, ExprValue>();
        for (Map.Entry<String, ExprValue> entry : bindings.entrySet()) {
            if (builtins.get(entry.getKey()) != entry.getValue()) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /** 全部绑定的只读视图 */
    public Map<String, ExprValue> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
