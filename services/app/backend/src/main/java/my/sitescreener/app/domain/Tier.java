package my.sitescreener.app.domain;

public enum Tier {
	A,
	B,
	C,
	D,
	F
}
