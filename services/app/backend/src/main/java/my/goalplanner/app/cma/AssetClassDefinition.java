package my.goalplanner.app.cma;

public class AssetClassDefinition {
	private String code;
	private String name;
	private Double expectedReturn;
	private Double volatility;
	private Double taxEfficiency;

	public String getCode() {
		return code;
	}

	public void setCode(String code) {
		this.code = code;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public Double getExpectedReturn() {
		return expectedReturn;
	}

	public void setExpectedReturn(Double expectedReturn) {
		this.expectedReturn = expectedReturn;
	}

	public Double getVolatility() {
		return volatility;
	}

	public void setVolatility(Double volatility) {
		this.volatility = volatility;
	}

	public Double getTaxEfficiency() {
		return taxEfficiency;
	}

	public void setTaxEfficiency(Double taxEfficiency) {
		this.taxEfficiency = taxEfficiency;
	}
}
