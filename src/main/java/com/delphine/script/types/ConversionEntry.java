package com.delphine.script.types;

/** A user-declared conversion FROM -> TO bound to a single-argument global function. */
public final class ConversionEntry {

    private final String from;
    private final String to;
    private final String bindingName;
    private final boolean implicit;

    public ConversionEntry(String from, String to, String bindingName, boolean implicit) {
        this.from = Names.normalize(from);
        this.to = Names.normalize(to);
        this.bindingName = bindingName;
        this.implicit = implicit;
    }

    public String getFrom() { return from; }
    public String getTo() { return to; }
    public String getBindingName() { return bindingName; }
    public boolean isImplicit() { return implicit; }

    public String key() {
        return key(from, to);
    }

    static String key(String from, String to) {
        return Names.normalize(from) + "->" + Names.normalize(to);
    }

    @Override
    public String toString() {
        return (implicit ? "implicit " : "explicit ") + from + "->" + to + " uses " + bindingName;
    }
}
