package pal.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 宿主枚举的镜像
 */
public final class PalNativeEnum extends PalValue implements MemberAccess {

    private final String name;
    private final Map<String, PalValue> members;

    public PalNativeEnum(String name, Map<String, ? extends PalValue> members) {
        this.name = name;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    /**
     * 由 Java 枚举构建，成员值为其序号
     */
    public static <E extends Enum<E>> PalNativeEnum of(Class<E> type) {
        Map<String, PalValue> members = new LinkedHashMap<>();
        for (E constant : type.getEnumConstants()) {
            members.put(constant.name(), PalNumber.of(constant.ordinal()));
        }
        return new PalNativeEnum(type.getSimpleName(), members);
    }

    public String getName() {
        return name;
    }

    public Map<String, PalValue> getMembers() {
        return members;
    }

    @Override
    public PalValue getMember(String member) {
        return members.get(member);
    }

    @Override
    public String getTypeName() {
        return "NativeEnum";
    }

    @Override
    public String toString() {
        return "<NativeEnum " + name + ">";
    }
}
