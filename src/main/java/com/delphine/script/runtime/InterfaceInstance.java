package com.delphine.script.runtime;

import com.delphine.script.types.InterfaceInfo;

/** An object viewed through an interface. */
public final class InterfaceInstance {

    private final InterfaceInfo iface;
    private final ObjectInstance target;

    public InterfaceInstance(InterfaceInfo iface, ObjectInstance target) {
        this.iface = iface;
        this.target = target;
    }

    public InterfaceInfo getInterface() { return iface; }
    public ObjectInstance getTarget() { return target; }
}
