package io.canopy.core.registry;

/// Registration details of a node type.
///
/// @param type registered type name
/// @param description human readable description, may be empty
/// @param builtin whether the type ships with the engine
public record NodeTypeInfo(String type, String description, boolean builtin) {}
