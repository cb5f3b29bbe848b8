package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.runtime.TemplateContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypedObjectAccessor 测试")
class TypedObjectAccessorTest {

    public record Product(String name, double price) {
    }

    public static class Account {
        public String owner = "ann";
        private int balance;
        private final boolean active = true;

        public int getBalance() {
            return balance;
        }

        public void setBalance(int balance) {
            this.balance = balance;
        }

        public boolean isActive() {
            return active;
        }

        public String getURL() {
            return "http://example.org";
        }
    }

    static class Hidden {
        public String getSecret() {
            return "x";
        }
    }

    private final TemplateContext context = new TemplateContext();

    @Test
    @DisplayName("record 组件")
    void testRecordComponents() {
        TypedObjectAccessor accessor = TypedObjectAccessor.of(Product.class);
        Product product = new Product("pen", 1.5);

        assertThat(accessor.getMembers(context, null, product)).containsExactly("name", "price");
        assertThat(accessor.getValue(context, null, product, "price")).isEqualTo(1.5);
        assertThat(accessor.trySetValue(context, null, product, "name", "book")).isFalse();
    }

    @Test
    @DisplayName("JavaBean 属性与公开字段")
    void testBeanProperties() {
        TypedObjectAccessor accessor = TypedObjectAccessor.of(Account.class);
        Account account = new Account();

        assertThat(accessor.getMembers(context, null, account)).contains("owner", "balance", "active", "URL");
        assertThat(accessor.getValue(context, null, account, "active")).isEqualTo(true);
        assertThat(accessor.getValue(context, null, account, "owner")).isEqualTo("ann");
        assertThat(accessor.hasMember(context, null, account, "class")).isFalse();
    }

    @Test
    @DisplayName("通过 setter 写入并转换类型")
    void testSetter() {
        TypedObjectAccessor accessor = TypedObjectAccessor.of(Account.class);
        Account account = new Account();

        boolean written = accessor.trySetValue(context, null, account, "balance", 42);

        assertThat(written).isTrue();
        assertThat(account.getBalance()).isEqualTo(42);
        assertThat(accessor.trySetValue(context, null, account, "active", false)).isFalse();
    }

    @Test
    @DisplayName("非 public 类型不暴露成员")
    void testNonPublicType() {
        TypedObjectAccessor accessor = TypedObjectAccessor.of(Hidden.class);

        assertThat(accessor.getMemberCount(context, null, new Hidden())).isZero();
    }

    @Test
    @DisplayName("同一类型复用同一个访问器")
    void testAccessorIsCached() {
        assertThat(TypedObjectAccessor.of(Product.class)).isSameAs(TypedObjectAccessor.of(Product.class));
    }
}
