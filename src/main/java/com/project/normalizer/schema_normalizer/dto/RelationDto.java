package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.RelationSchema;

import java.util.List;

public class RelationDto {
	private String name;
	private List<String> columns;
	private List<String> primaryKey;
	private List<String> foreignKeys;
	private List<String> dependencies;
	private boolean optional;

	public RelationDto() {
	}

	public static RelationDto from(RelationSchema relation) {
		RelationDto dto = new RelationDto();
		dto.name = relation.name();
		dto.columns = relation.columnOrder();
		dto.primaryKey = relation.primaryKey().asList();
		dto.foreignKeys = relation.foreignKeys().stream().map(Object::toString).toList();
		dto.dependencies = DependencyDto.notations(relation.dependencies());
		dto.optional = relation.optional();
		return dto;
	}

	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}

	public List<String> getColumns() {
		return columns;
	}
	public void setColumns(List<String> columns) {
		this.columns = columns;
	}

	public List<String> getPrimaryKey() {
		return primaryKey;
	}
	public void setPrimaryKey(List<String> primaryKey) {
		this.primaryKey = primaryKey;
	}

	public List<String> getForeignKeys() {
		return foreignKeys;
	}
	public void setForeignKeys(List<String> foreignKeys) {
		this.foreignKeys = foreignKeys;
	}

	public List<String> getDependencies() {
		return dependencies;
	}
	public void setDependencies(List<String> dependencies) {
		this.dependencies = dependencies;
	}

	public boolean isOptional() {
		return optional;
	}
	public void setOptional(boolean optional) {
		this.optional = optional;
	}
}
