/*-
 * #%L
 * This file is part of SkyFind.
 * %%
 * Copyright (C) 2024 - 2026 SkyFind developers
 * %%
 * SkyFind is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SkyFind is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SkyFind.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package skyfind.lib.objects;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import skyfind.lib.geom.SkyCoordinate;

/**
 * An immutable catalog entry for a known star or galaxy.
 * <p>
 * The index is the row of the object in its catalog, and is used to key all per-frame 
 * results and merged cross-band tables.
 * 
 * @author SkyFind developers
 */
public final class CatalogObject implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final int index;
	private final ObjectKind kind;
	private final String catalog;
	private final String id;
	private final SkyCoordinate position;
	private final Double positionError;
	private final Map<String, Double> magnitudes;
	private final Map<String, Double> magnitudeErrors;
	private final GalaxyAttributes galaxy;
	
	private CatalogObject(Builder builder) {
		this.index = builder.index;
		this.kind = builder.kind;
		this.catalog = builder.catalog;
		this.id = builder.id;
		this.position = builder.position;
		this.positionError = builder.positionError;
		this.magnitudes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.magnitudes));
		this.magnitudeErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.magnitudeErrors));
		this.galaxy = builder.galaxy;
	}
	
	/**
	 * Create a builder for a star.
	 * @param index row index in the catalog
	 * @param position
	 * @return
	 */
	public static Builder star(int index, SkyCoordinate position) {
		return new Builder(index, ObjectKind.STAR, position);
	}
	
	/**
	 * Create a builder for a galaxy.
	 * @param index row index in the catalog
	 * @param position
	 * @param attributes
	 * @return
	 */
	public static Builder galaxy(int index, SkyCoordinate position, GalaxyAttributes attributes) {
		var builder = new Builder(index, ObjectKind.GALAXY, position);
		builder.galaxy = Objects.requireNonNull(attributes);
		builder.id = attributes.getName();
		return builder;
	}
	
	/**
	 * Create a copy of this object with a different catalog index.
	 * @param newIndex
	 * @return
	 */
	public CatalogObject withIndex(int newIndex) {
		var builder = new Builder(newIndex, kind, position);
		builder.catalog = catalog;
		builder.id = id;
		builder.positionError = positionError;
		builder.magnitudes.putAll(getMagnitudes());
		builder.magnitudeErrors.putAll(getMagnitudeErrors());
		builder.galaxy = galaxy;
		return builder.build();
	}

	/**
	 * Row index of the object in its catalog.
	 * @return
	 */
	public int getIndex() {
		return index;
	}

	@SuppressWarnings("javadoc")
	public ObjectKind getKind() {
		return kind;
	}

	/**
	 * Name of the source catalog, e.g. "2MASS".
	 * @return
	 */
	public String getCatalog() {
		return catalog;
	}

	/**
	 * Identifier of the object within its source catalog.
	 * @return
	 */
	public String getId() {
		return id;
	}

	@SuppressWarnings("javadoc")
	public SkyCoordinate getPosition() {
		return position;
	}

	/**
	 * Positional uncertainty, in arcseconds, or null.
	 * @return
	 */
	public Double getPositionError() {
		return positionError;
	}

	/**
	 * Catalog magnitudes, keyed by band name.
	 * @return
	 */
	public Map<String, Double> getMagnitudes() {
		return magnitudes == null ? Collections.emptyMap() : magnitudes;
	}

	/**
	 * Catalog magnitude errors, keyed by band name.
	 * @return
	 */
	public Map<String, Double> getMagnitudeErrors() {
		return magnitudeErrors == null ? Collections.emptyMap() : magnitudeErrors;
	}

	/**
	 * Galaxy-specific attributes, or null for stars.
	 * @return
	 */
	public GalaxyAttributes getGalaxy() {
		return galaxy;
	}
	
	/**
	 * Query whether this object is the principal galaxy.
	 * @return
	 */
	public boolean isPrincipal() {
		return galaxy != null && galaxy.isPrincipal();
	}
	
	/**
	 * Query whether this object is a companion galaxy.
	 * @return
	 */
	public boolean isCompanion() {
		return galaxy != null && galaxy.isCompanion();
	}

	@Override
	public String toString() {
		return kind + " " + index + " (" + (id == null ? "unnamed" : id) + ")";
	}
	
	
	/**
	 * Builder for {@link CatalogObject}.
	 */
	public static class Builder {
		
		private final int index;
		private final ObjectKind kind;
		private final SkyCoordinate position;
		private String catalog;
		private String id;
		private Double positionError;
		private final Map<String, Double> magnitudes = new LinkedHashMap<>();
		private final Map<String, Double> magnitudeErrors = new LinkedHashMap<>();
		private GalaxyAttributes galaxy;
		
		private Builder(int index, ObjectKind kind, SkyCoordinate position) {
			if (index < 0)
				throw new IllegalArgumentException("Catalog index must be >= 0, but was " + index);
			this.index = index;
			this.kind = kind;
			this.position = Objects.requireNonNull(position, "Position must not be null");
		}
		
		@SuppressWarnings("javadoc")
		public Builder catalog(String catalog) {
			this.catalog = catalog;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder id(String id) {
			this.id = id;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder positionError(Double positionError) {
			this.positionError = positionError;
			return this;
		}
		
		/**
		 * Add a catalog magnitude.
		 * @param band
		 * @param magnitude
		 * @param error error of the magnitude, or null
		 * @return
		 */
		public Builder magnitude(String band, double magnitude, Double error) {
			magnitudes.put(band, magnitude);
			if (error != null)
				magnitudeErrors.put(band, error);
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public CatalogObject build() {
			return new CatalogObject(this);
		}
		
	}

}
