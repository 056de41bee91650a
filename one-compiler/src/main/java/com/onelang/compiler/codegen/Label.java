package com.onelang.compiler.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 跳转标签：记录引用它的指令下标，绑定位置后统一回填
 */
final class Label {

    private final int id;
    private final List<Integer> patchSites = new ArrayList<Integer>();
    private int position = -1;

    Label(int id) {
        this.id = id;
    }

    String getName() {
        return "L" + id;
    }

    void addPatchSite(int index) {
        patchSites.add(index);
    }

    List<Integer> getPatchSites() {
        return Collections.unmodifiableList(patchSites);
    }

    boolean isBound() {
        return position >= 0;
    }

    int getPosition() {
        return position;
    }

    void bind(int position) {
        if (isBound()) {
            throw new IllegalStateException("Label " + getName() + " already bound");
        }
        this.position = position;
    }

    @Override
    public String toString() {
        return getName();
    }
}
