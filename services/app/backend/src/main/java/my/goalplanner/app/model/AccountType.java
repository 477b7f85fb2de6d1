package my.goalplanner.app.model;

import lombok.Getter;

@Getter
public enum AccountType {
	TAXABLE("taxable"),
	TAX_DEFERRED("tax_deferred"),
	TAX_EXEMPT("tax_exempt");

	private final String key;

	AccountType(String key) {
		this.key = key;
	}
}
