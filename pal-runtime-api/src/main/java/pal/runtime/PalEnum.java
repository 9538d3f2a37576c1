package pal.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 脚本中声明的枚举（{@code namespace}），成员值为其序号
 */
public final class PalEnum extends PalValue implements MemberAccess {

    private final String name;
    private final List<String> members = new ArrayList<>();

    public PalEnum(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 追加成员
     *
     * @return 成员已存在时返回 false
     */
    public boolean addMember(String member) {
        if (members.contains(member)) {
            return false;
        }
        members.add(member);
        return true;
    }

    public List<String> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public PalValue getMember(String member) {
        int index = members.indexOf(member);
        return index < 0 ? null : PalNumber.of(index);
    }

    @Override
    public String getTypeName() {
        return "Enum";
    }

    @Override
    public String toString() {
        return "<Enum " + name + ">";
    }
}
