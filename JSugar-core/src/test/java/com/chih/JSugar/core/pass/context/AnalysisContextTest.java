package com.chih.JSugar.core.pass.context;

import com.chih.JSugar.core.ast.OutputContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnalysisContext 测试")
class AnalysisContextTest {

    @Test
    @DisplayName("不可变的标签栈")
    void testImmutableStack() {
        AnalysisContext root = AnalysisContext.empty();
        AnalysisContext inScript = root.push("div").push("SCRIPT");

        assertThat(root.getElementStack()).isEmpty();
        assertThat(inScript.getElementStack()).containsExactly("div", "script");
        assertThat(inScript.determineContext()).isEqualTo(OutputContext.JAVASCRIPT);
        assertThat(root.determineContext()).isEqualTo(OutputContext.HTML);
    }

    @Test
    @DisplayName("pop 移除最后一个同名标签")
    void testPop() {
        AnalysisContext context = AnalysisContext.empty().push("style").push("div").push("style");

        AnalysisContext popped = context.pop("style");

        assertThat(popped.getElementStack()).containsExactly("style", "div");
        assertThat(popped.determineContext()).isEqualTo(OutputContext.CSS);
        assertThat(popped.pop("span").getElementStack()).containsExactly("style", "div");
    }
}
