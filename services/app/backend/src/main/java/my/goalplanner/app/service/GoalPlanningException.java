package my.goalplanner.app.service;

/**
 * Raised when a call is structurally invalid, for example placement without accounts.
 */
public class GoalPlanningException extends RuntimeException {
	public static final String ACCOUNTS_EMPTY = "ACCOUNTS_EMPTY";
	public static final String ACCOUNT_DUPLICATE = "ACCOUNT_DUPLICATE";
	public static final String GOAL_MISSING = "GOAL_MISSING";
	public static final String GOAL_DUPLICATE = "GOAL_DUPLICATE";
	public static final String CMA_INVALID = "CMA_INVALID";

	private final String errorCode;

	public GoalPlanningException(String message, String errorCode) {
		super(message);
		this.errorCode = errorCode;
	}

	public GoalPlanningException(String message, String errorCode, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public String getErrorCode() {
		return errorCode;
	}
}
