package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 访问段：一个访问标签到下一个标签之间声明的成员名
 */
public class AccessSection {
    private final AccessLevel level;
    private final List<String> members = new ArrayList<String>();

    public AccessSection(AccessLevel level) {
        this.level = level;
    }

    public AccessLevel getLevel() {
        return level;
    }

    public List<String> getMembers() {
        return members;
    }

    public void addMember(String member) {
        members.add(member);
    }
}
