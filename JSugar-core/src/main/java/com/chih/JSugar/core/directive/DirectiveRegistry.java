package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.directive.impl.BooleanAttributeDirective;
import com.chih.JSugar.core.directive.impl.ClassDirective;
import com.chih.JSugar.core.directive.impl.ContentDirective;
import com.chih.JSugar.core.directive.impl.ElseDirective;
import com.chih.JSugar.core.directive.impl.EmptyDirective;
import com.chih.JSugar.core.directive.impl.FinallyDirective;
import com.chih.JSugar.core.directive.impl.ForeachDirective;
import com.chih.JSugar.core.directive.impl.ForelseDirective;
import com.chih.JSugar.core.directive.impl.IfBlockDirective;
import com.chih.JSugar.core.directive.impl.IfContentDirective;
import com.chih.JSugar.core.directive.impl.IfDirective;
import com.chih.JSugar.core.directive.impl.IssetDirective;
import com.chih.JSugar.core.directive.impl.NoWrapDirective;
import com.chih.JSugar.core.directive.impl.PassThroughDirective;
import com.chih.JSugar.core.directive.impl.SpreadDirective;
import com.chih.JSugar.core.directive.impl.SwitchDirective;
import com.chih.JSugar.core.directive.impl.TagDirective;
import com.chih.JSugar.core.directive.impl.TimesDirective;
import com.chih.JSugar.core.directive.impl.TryDirective;
import com.chih.JSugar.core.directive.impl.UnlessDirective;
import com.chih.JSugar.core.directive.impl.WhileDirective;
import com.chih.JSugar.core.exception.JSugarException;
import com.chih.JSugar.core.exception.UnknownDirectiveException;
import com.chih.JSugar.core.support.DidYouMean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 指令注册表：名称 -> 编译器
 * <p>
 * 既可以注册实例，也可以注册实现类（首次 {@link #get} 时通过无参构造器实例化并缓存）。
 * 保留注册顺序，"Did you mean" 建议在距离相同时取先注册的名称。
 * </p>
 * <p>
 * 编译期间注册表只读，注册应当在编译开始前完成。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/14
 */
public class DirectiveRegistry {

    private static final Logger log = LoggerFactory.getLogger(DirectiveRegistry.class);

    private final Map<String, Object> directives = new LinkedHashMap<>();

    protected DirectiveRegistry() {
    }

    /**
     * @return 不含任何指令的注册表
     */
    public static DirectiveRegistry empty() {
        return new DirectiveRegistry();
    }

    /**
     * @return 注册了全部内置指令的注册表
     */
    public static DirectiveRegistry withDefaults() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.registerDefaults();
        return registry;
    }

    public synchronized DirectiveRegistry register(String name, DirectiveCompiler compiler) {
        if (compiler == null) {
            throw new IllegalArgumentException("compiler must not be null for directive: " + name);
        }
        return put(name, compiler);
    }

    /**
     * 延迟注册：首次使用时实例化
     */
    public synchronized DirectiveRegistry register(String name, Class<? extends DirectiveCompiler> compilerClass) {
        if (compilerClass == null) {
            throw new IllegalArgumentException("compiler class must not be null for directive: " + name);
        }
        return put(name, compilerClass);
    }

    public synchronized boolean has(String name) {
        return directives.containsKey(name);
    }

    /**
     * @throws UnknownDirectiveException 名称未注册，附带最接近的已注册名称作为建议
     */
    public synchronized DirectiveCompiler get(String name) {
        Object entry = directives.get(name);
        if (entry == null) {
            String suggestion = DidYouMean.suggest(name, directives.keySet());
            throw new UnknownDirectiveException(name, suggestion);
        }

        if (entry instanceof DirectiveCompiler compiler) {
            return compiler;
        }

        DirectiveCompiler compiler = instantiate(name, (Class<?>) entry);
        directives.put(name, compiler);
        return compiler;
    }

    /**
     * @return 按注册顺序排列的名称
     */
    public synchronized List<String> names() {
        return List.copyOf(directives.keySet());
    }

    /**
     * 解析全部延迟注册的编译器
     */
    public synchronized Map<String, DirectiveCompiler> all() {
        Map<String, DirectiveCompiler> resolved = new LinkedHashMap<>();
        for (String name : new ArrayList<>(directives.keySet())) {
            resolved.put(name, get(name));
        }
        return Collections.unmodifiableMap(resolved);
    }

    public synchronized Map<String, DirectiveCompiler> getByType(DirectiveType type) {
        Map<String, DirectiveCompiler> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, DirectiveCompiler> entry : all().entrySet()) {
            if (entry.getValue().getType() == type) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(filtered);
    }

    private DirectiveRegistry put(String name, Object compiler) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("directive name must not be empty");
        }
        if (directives.containsKey(name)) {
            log.warn("Directive '{}' is already registered, overriding it", name);
        }
        directives.put(name, compiler);
        return this;
    }

    private DirectiveCompiler instantiate(String name, Class<?> compilerClass) {
        if (!DirectiveCompiler.class.isAssignableFrom(compilerClass)) {
            throw new JSugarException("Directive class " + compilerClass.getName()
                    + " must implement " + DirectiveCompiler.class.getName());
        }
        try {
            log.debug("Instantiating directive '{}' from {}", name, compilerClass.getName());
            return (DirectiveCompiler) compilerClass.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new JSugarException("Directive class " + compilerClass.getName()
                    + " must declare a public no-arg constructor", e);
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new JSugarException("Failed to instantiate directive class " + compilerClass.getName(), e);
        }
    }

    private void registerDefaults() {
        // control flow
        directives.put("if", IfDirective.class);
        directives.put("ifblock", IfBlockDirective.class);
        directives.put("elseif", IfDirective.class);
        directives.put("else", ElseDirective.class);
        directives.put("unless", UnlessDirective.class);
        directives.put("isset", IssetDirective.class);
        directives.put("empty", EmptyDirective.class);
        directives.put("notempty", EmptyDirective.class);
        directives.put("switch", SwitchDirective.class);
        directives.put("case", SwitchDirective.class);
        directives.put("default", SwitchDirective.class);
        directives.put("try", TryDirective.class);
        directives.put("finally", FinallyDirective.class);
        // loops
        directives.put("foreach", ForeachDirective.class);
        directives.put("forelse", ForelseDirective.class);
        directives.put("while", WhileDirective.class);
        directives.put("times", TimesDirective.class);
        // attributes
        directives.put("class", ClassDirective.class);
        directives.put("spread", SpreadDirective.class);
        directives.put("attr", SpreadDirective.class);
        directives.put("checked", BooleanAttributeDirective.class);
        directives.put("selected", BooleanAttributeDirective.class);
        directives.put("disabled", BooleanAttributeDirective.class);
        // element rewriting
        directives.put("tag", TagDirective.class);
        directives.put("ifcontent", IfContentDirective.class);
        // handled by other passes
        directives.put("slot", PassThroughDirective.class);
        directives.put("bind", PassThroughDirective.class);
        directives.put("raw", PassThroughDirective.class);
        // content modifiers
        directives.put("nowrap", NoWrapDirective.class);
        // content
        directives.put("text", ContentDirective.class);
        directives.put("html", ContentDirective.class);
    }
}
