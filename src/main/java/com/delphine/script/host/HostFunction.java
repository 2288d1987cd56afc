package com.delphine.script.host;

import java.util.List;

/**
 * Host-native function callable from scripts. Arguments arrive already
 * marshalled to Java values; whatever it throws becomes an EHost exception.
 */
@FunctionalInterface
public interface HostFunction {
    Object invoke(List<Object> args) throws Exception;
}
