package org.whileverifier.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理程序变量名到 Z3 整数常量的映射。
 * 确保每个变量名在 Z3 Context 中有唯一的对应常量。
 * 每个实例只属于一个求解会话，不会被并发访问。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 TreeMap 存储映射，遍历顺序即变量名顺序，模型提取结果因此稳定
    private final SortedMap<String, IntExpr> z3Vars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Vars = new TreeMap<>();
    }

    /**
     * 获取指定变量对应的 Z3 整数常量。
     * 如果常量尚未创建，则会创建并缓存。
     * @param name 变量名。
     * @return 对应的 Z3 IntExpr 常量。
     */
    public IntExpr getZ3Var(String name) {
        return z3Vars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 整数常量: {}", n);
            return ctx.mkIntConst(n);
        });
    }

    /**
     * @return 已声明的变量名，按名字排序。
     */
    public Set<String> getDeclaredNames() {
        return Collections.unmodifiableSet(z3Vars.keySet());
    }
}
