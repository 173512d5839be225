package com.project.normalizer.schema_normalizer.exception;

import com.project.normalizer.schema_normalizer.model.ForeignKey;

import java.util.List;

// A child relation references key values its parent relation does not contain
public class OrphanForeignKeyException extends NormalizationException {

	private static final int MESSAGE_SAMPLE = 10;

	private final String childRelation;
	private final ForeignKey foreignKey;
	private final List<List<Object>> orphanValues;

	public OrphanForeignKeyException(String childRelation, ForeignKey foreignKey, List<List<Object>> orphanValues) {
		super(buildMessage(childRelation, foreignKey, orphanValues));
		this.childRelation = childRelation;
		this.foreignKey = foreignKey;
		this.orphanValues = List.copyOf(orphanValues);
	}

	private static String buildMessage(String child, ForeignKey fk, List<List<Object>> orphans) {
		List<List<Object>> shown = orphans.size() > MESSAGE_SAMPLE ? orphans.subList(0, MESSAGE_SAMPLE) : orphans;
		return child + "." + fk.localColumns() + " has " + orphans.size() + " orphan value(s) not in "
				+ fk.parentRelation() + fk.parentKey() + ": " + shown + (orphans.size() > MESSAGE_SAMPLE ? " ..." : "");
	}

	public String getChildRelation() { return childRelation; }
	public ForeignKey getForeignKey() { return foreignKey; }
	public List<List<Object>> getOrphanValues() { return orphanValues; }

	@Override
	public String getKind() {
		return "OrphanForeignKey";
	}
}
