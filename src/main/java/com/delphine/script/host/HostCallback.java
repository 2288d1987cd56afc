package com.delphine.script.host;

import java.util.List;

/**
 * A script function pointer handed to host code. Calling it re-enters the
 * interpreter synchronously on the same thread.
 *
 * @throws ScriptCallbackException when the script raised or failed
 */
@FunctionalInterface
public interface HostCallback {
    Object call(List<Object> args);
}
