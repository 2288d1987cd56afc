package com.delphine.script.interp;

/** Pending non-local transfer, checked after every statement like the exception flag. */
enum ControlSignal {
    NONE, BREAK, CONTINUE, EXIT
}
