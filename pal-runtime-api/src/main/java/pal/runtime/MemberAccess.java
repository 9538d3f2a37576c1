package pal.runtime;

/**
 * 支持 {@code a.b} 成员读取的值
 */
public interface MemberAccess {

    /**
     * @return 成员值；不存在时返回 null
     */
    PalValue getMember(String name);
}
