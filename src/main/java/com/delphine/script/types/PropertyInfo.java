package com.delphine.script.types;

import java.util.Collections;
import java.util.List;

/**
 * Property descriptor. Read and write specs name either a field or a method of
 * the owning type. Indexed properties route through methods taking the indices
 * as leading parameters.
 */
public final class PropertyInfo {

    private final String name;
    private final DataType type;
    private final List<DataType> indexTypes;
    private final String readSpec;
    private final String writeSpec;
    private final boolean isDefault;

    public PropertyInfo(String name, DataType type, List<DataType> indexTypes,
                        String readSpec, String writeSpec, boolean isDefault) {
        this.name = name;
        this.type = type;
        this.indexTypes = indexTypes == null ? Collections.emptyList() : indexTypes;
        this.readSpec = readSpec;
        this.writeSpec = writeSpec;
        this.isDefault = isDefault;
    }

    public String getName() { return name; }
    public DataType getType() { return type; }
    public List<DataType> getIndexTypes() { return indexTypes; }
    public String getReadSpec() { return readSpec; }
    public String getWriteSpec() { return writeSpec; }
    public boolean isDefault() { return isDefault; }

    public boolean isIndexed() {
        return !indexTypes.isEmpty();
    }

    public boolean isReadable() {
        return readSpec != null;
    }

    public boolean isWritable() {
        return writeSpec != null;
    }
}
