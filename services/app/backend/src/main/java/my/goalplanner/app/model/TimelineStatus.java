package my.goalplanner.app.model;

public enum TimelineStatus {
	ACHIEVABLE,
	TIMELINE_EXTENSION_NEEDED
}
