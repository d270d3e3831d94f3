package org.exprengine.expressions;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.exprengine.core.SymbolTable;
import org.exprengine.core.Variable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.exprengine.expressions.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionsTest {

    private static Variable a, b;

    @BeforeAll
    static void setUp() {
        SymbolTable table = new SymbolTable();
        a = table.declare("a", 2);
        b = table.declare("b", 3);
    }

    @Nested
    @DisplayName("构造 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("二元构造方法生成对应的 Binary 节点")
        void testBinaryBuilders() {
            Binary sum = add(a.ref(), b.ref());
            Binary quotient = div(a.ref(), b.ref());

            assertAll("Binary builders",
                    () -> assertEquals(OperationType.PLUS, sum.getOperation()),
                    () -> assertEquals(a.ref(), sum.getLeft()),
                    () -> assertEquals(b.ref(), sum.getRight()),
                    () -> assertEquals(OperationType.MINUS, sub(a.ref(), b.ref()).getOperation()),
                    () -> assertEquals(OperationType.MUL, mul(a.ref(), b.ref()).getOperation()),
                    () -> assertEquals(OperationType.DIV, quotient.getOperation())
            );
        }

        @Test
        @DisplayName("double 参数被提升为 Constant")
        void testLiteralPromotion() {
            assertAll("Literals become constants on either side",
                    () -> assertEquals(new Binary(OperationType.PLUS, constant(7), a.ref()), add(7, a.ref())),
                    () -> assertEquals(new Binary(OperationType.MINUS, a.ref(), constant(7)), sub(a.ref(), 7)),
                    () -> assertEquals(new Unary(OperationType.MINUS, constant(2)), negate(2)),
                    () -> assertEquals(new Assign(OperationType.ASSIGN, a, constant(4)), assign(a, 4))
            );
        }

        @Test
        @DisplayName("赋值构造方法的目标是 Variable")
        void testAssignBuilders() {
            Assign assign = addAssign(a, sub(b.ref(), a.ref()));

            assertAll("Assignment builders",
                    () -> assertEquals(a, assign.getTarget()),
                    () -> assertEquals(OperationType.PLUS, assign.getOperation()),
                    () -> assertEquals(OperationType.ASSIGN, assign(a, b.ref()).getOperation()),
                    () -> assertEquals(OperationType.MINUS, subAssign(a, 1).getOperation()),
                    () -> assertEquals(OperationType.MUL, mulAssign(a, 1).getOperation()),
                    () -> assertEquals(OperationType.DIV, divAssign(a, 1).getOperation())
            );
        }

        @Test
        @DisplayName("一元构造方法")
        void testUnaryBuilders() {
            assertEquals(OperationType.PLUS, plus(a.ref()).getOperation());
            assertEquals(OperationType.MINUS, negate(a.ref()).getOperation());
            assertEquals(constant(1.5), plus(1.5).getOperand());
        }
    }

    @Nested
    @DisplayName("非法构造 (Invalid construction)")
    class InvalidConstructionTests {

        @Test
        @DisplayName("一元节点只接受 PLUS 和 MINUS")
        void testUnary_RejectsOtherOperations() {
            assertThrows(IllegalArgumentException.class, () -> new Unary(OperationType.MUL, constant(1)));
            assertThrows(IllegalArgumentException.class, () -> new Unary(OperationType.DIV, constant(1)));
            assertThrows(IllegalArgumentException.class, () -> new Unary(OperationType.ASSIGN, constant(1)));
        }

        @Test
        @DisplayName("二元节点不接受 ASSIGN")
        void testBinary_RejectsAssign() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Binary(OperationType.ASSIGN, constant(1), constant(2)));
        }

        @Test
        @DisplayName("子节点不能为 null")
        void testNullChildren() {
            assertThrows(NullPointerException.class, () -> add(null, a.ref()));
            assertThrows(NullPointerException.class, () -> assign(null, a.ref()));
            assertThrows(NullPointerException.class, () -> negate((Expression) null));
            assertThrows(NullPointerException.class, () -> ref(null));
        }
    }

    @Nested
    @DisplayName("结构相等 (Structural equality)")
    class EqualityTests {

        @Test
        @DisplayName("结构相同的树相等")
        void testEquals_SameStructure() {
            Expression first = mul(add(a.ref(), b.ref()), 2);
            Expression second = mul(add(ref(a), ref(b)), constant(2));

            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());
        }

        @Test
        @DisplayName("结合方式不同的树不相等")
        void testEquals_DifferentShape() {
            Expression left = sub(sub(a.ref(), b.ref()), a.ref());
            Expression right = sub(a.ref(), sub(b.ref(), a.ref()));

            assertNotEquals(left, right);
            assertNotEquals(add(a.ref(), b.ref()), addAssign(a, b.ref()));
            assertNotEquals(constant(0.0), constant(-0.0));
        }

        @Test
        @DisplayName("变量按下标区分")
        void testVariable_IdentityIsIndex() {
            assertEquals(a, Variable.ofIndex(0));
            assertNotEquals(a, b);
            assertEquals(a.ref(), ref(Variable.ofIndex(0)));
        }
    }

    @Test
    @DisplayName("构造日志只记录运算符和子节点类型，不展开整棵子树")
    void testConstructorDebugLog_DoesNotFormatSubtree() {
        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(Binary.class);
        Level originalLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        try {
            add(add(a.ref(), b.ref()), a.ref());

            assertEquals(2, appender.list.size());
            assertEquals("创建 Binary: PLUS (VariableRef, VariableRef)",
                    appender.list.get(0).getFormattedMessage());
            assertEquals("创建 Binary: PLUS (Binary, VariableRef)",
                    appender.list.get(1).getFormattedMessage());
        } finally {
            logger.setLevel(originalLevel);
            logger.detachAppender(appender);
        }
    }
}
