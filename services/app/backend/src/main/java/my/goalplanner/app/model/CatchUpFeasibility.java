package my.goalplanner.app.model;

public enum CatchUpFeasibility {
	HIGH,
	MEDIUM,
	CHALLENGING
}
