package my.sitescreener.app.provider;

public enum FactSet {
	GEOGRAPHY,
	DEMOGRAPHICS
}
