package my.goalplanner.app.cma;

import java.util.List;

public class CapitalMarketAssumptionsDefinition {
	private int schemaVersion;
	private String name;
	private String asOf;
	private List<AssetClassDefinition> assetClasses;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getAsOf() {
		return asOf;
	}

	public void setAsOf(String asOf) {
		this.asOf = asOf;
	}

	public List<AssetClassDefinition> getAssetClasses() {
		return assetClasses;
	}

	public void setAssetClasses(List<AssetClassDefinition> assetClasses) {
		this.assetClasses = assetClasses;
	}
}
