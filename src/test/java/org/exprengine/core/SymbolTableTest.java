package org.exprengine.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.apache.commons.lang3.tuple.Pair;
import org.exprengine.exceptions.OutOfRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    private SymbolTable table;
    private Variable a, b, c;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
        a = table.declare("a", 2);
        b = table.declare("b", 3);
        c = table.declare("c", 0);
    }

    @Nested
    @DisplayName("声明变量 (declare)")
    class DeclareTests {

        @Test
        @DisplayName("下标从 0 开始按声明顺序递增")
        void testDeclare_AssignsIncreasingIndices() {
            assertAll("Indices follow declaration order",
                    () -> assertEquals(0, a.getIndex()),
                    () -> assertEquals(1, b.getIndex()),
                    () -> assertEquals(2, c.getIndex()),
                    () -> assertEquals(3, table.size())
            );
        }

        @Test
        @DisplayName("重名变量仍然得到不同的下标")
        void testDeclare_DuplicateNameGetsNewIndex() {
            Variable another = table.declare("a", 7);

            assertNotEquals(a, another, "Same name must not mean same variable");
            assertEquals(3, another.getIndex());
            assertEquals("a", table.nameOf(another));
        }

        @Test
        @DisplayName("空白名称应抛出异常")
        void testDeclare_BlankNameIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> table.declare("  ", 1));
            assertThrows(IllegalArgumentException.class, () -> table.declare(null, 1));
            assertEquals(3, table.size(), "A rejected declaration must not allocate a slot");
        }
    }

    @Nested
    @DisplayName("名称查找 (nameOf)")
    class NameOfTests {

        @Test
        @DisplayName("返回声明时的名称")
        void testNameOf_ReturnsDeclaredName() {
            assertAll(
                    () -> assertEquals("a", table.nameOf(a)),
                    () -> assertEquals("b", table.nameOf(b)),
                    () -> assertEquals("c", table.nameOf(2))
            );
        }

        @Test
        @DisplayName("不属于此符号表的下标应抛出 OutOfRangeException")
        void testNameOf_UnknownIndexThrows() {
            OutOfRangeException e = assertThrows(OutOfRangeException.class,
                    () -> table.nameOf(Variable.ofIndex(3)));

            assertEquals(3, e.getIndex());
            assertEquals(3, e.getSize());
            assertThrows(OutOfRangeException.class, () -> table.nameOf(-1));
            assertThrows(OutOfRangeException.class, () -> new SymbolTable().nameOf(a));
        }
    }

    @Nested
    @DisplayName("初始状态 (createState)")
    class CreateStateTests {

        @Test
        @DisplayName("状态向量包含按声明顺序排列的初始值")
        void testCreateState_SeedsInitialValues() {
            State state = table.createState();

            assertEquals(State.of(2, 3, 0), state);
            assertEquals(2, table.initialValueOf(a));
        }

        @Test
        @DisplayName("每次调用返回独立的状态向量")
        void testCreateState_ReturnsIndependentBuffers() {
            State first = table.createState();
            State second = table.createState();

            first.set(c, 42);

            assertEquals(0, second.get(c));
            assertEquals(0, table.initialValueOf(c), "Initial values must not follow buffer writes");
        }

        @Test
        @DisplayName("空符号表生成空向量")
        void testCreateState_EmptyTable() {
            assertEquals(0, new SymbolTable().createState().size());
        }
    }

    @Test
    @DisplayName("名称列表不可修改，entries 与声明顺序一致")
    void testViews() {
        List<String> names = table.getNames();

        assertEquals(List.of("a", "b", "c"), names);
        assertThrows(UnsupportedOperationException.class, () -> names.add("d"));
        assertEquals(List.of(a, b, c), table.getVariables());
        assertEquals(Pair.of(b, "b"), table.entries().get(1));
    }

    @Test
    @DisplayName("只有重复的名称才会产生警告")
    void testDeclare_WarnsOnlyOnDuplicateName() {
        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(SymbolTable.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SymbolTable fresh = new SymbolTable();
            for (int i = 0; i < 50; i++) {
                fresh.declare("v" + i, i);
            }
            assertEquals(0, appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count());

            Variable again = fresh.declare("v7", 1);

            assertEquals(1, appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count());
            assertEquals(50, again.getIndex());
            assertEquals("v7", fresh.nameOf(again));
        } finally {
            logger.detachAppender(appender);
        }
    }
}
