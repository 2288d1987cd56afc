package com.delphine.script.host;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks a public method for {@link HostFunctionRegistry#registerMethods(Object)}. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface HostExport {

    /** Script-visible name; the Java method name when empty. */
    String value() default "";
}
