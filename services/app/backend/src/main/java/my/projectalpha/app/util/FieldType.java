package my.projectalpha.app.util;

public enum FieldType {
	STRING,
	TEXT,
	DECIMAL,
	RATE,
	INTEGER,
	BOOLEAN,
	DATE
}
