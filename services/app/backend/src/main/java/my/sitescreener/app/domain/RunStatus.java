package my.sitescreener.app.domain;

public enum RunStatus {
	PENDING,
	RUNNING,
	COMPLETE,
	ERROR
}
