package com.apexframe.core.manifest;

/**
 * 清单文件中的字段名
 */
final class ManifestFields {

    static final String ID = "id";
    static final String VERSION = "version";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String ENTRY_REFERENCE = "entry_reference";
    static final String DECLARED_PERMISSIONS = "declared_permissions";
    static final String DEPENDENCIES = "dependencies";
    static final String PLUGIN_ID = "plugin_id";
    static final String VERSION_RANGE = "version_range";
    static final String ACTIONS = "actions";
    static final String INPUT_SCHEMA = "input_schema";
    static final String STREAMS_OUTPUT = "streams_output";
    static final String REQUIRED_PERMISSIONS = "required_permissions";
    static final String PROPERTIES = "properties";
    static final String SHARED_PACKAGES = "shared_packages";

    private ManifestFields() {
    }
}
