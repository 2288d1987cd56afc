package com.delphine.script.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EnumType implements DataType {

    private final String name;
    private final List<String> memberNames = new ArrayList<>();
    private final Map<String, Long> ordinals = new LinkedHashMap<>();

    public EnumType(String name) {
        this.name = name;
    }

    public void addMember(String member, long ordinal) {
        String key = Names.normalize(member);
        if (ordinals.containsKey(key)) {
            throw new TypeDeclarationException("duplicate enum member " + member + " in " + name);
        }
        memberNames.add(member);
        ordinals.put(key, ordinal);
    }

    public boolean hasMember(String member) {
        return ordinals.containsKey(Names.normalize(member));
    }

    public long ordinalOf(String member) {
        Long o = ordinals.get(Names.normalize(member));
        if (o == null) throw new IllegalArgumentException("no member " + member + " in " + name);
        return o;
    }

    /** @return the declared member name for an ordinal, or null */
    public String nameOf(long ordinal) {
        for (String m : memberNames) {
            if (ordinals.get(Names.normalize(m)) == ordinal) return m;
        }
        return null;
    }

    public List<String> getMemberNames() {
        return Collections.unmodifiableList(memberNames);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.ENUM;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
