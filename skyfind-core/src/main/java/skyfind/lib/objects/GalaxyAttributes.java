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
import java.util.List;

/**
 * Catalog attributes specific to extended sources.
 * <p>
 * Axes are diameters in arcminutes and the position angle is measured in degrees 
 * from north through east. Any of the numeric attributes may be null when unknown.
 * 
 * @author SkyFind developers
 */
public final class GalaxyAttributes implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final String name;
	private final boolean principal;
	private final String parent;
	private final List<String> companions;
	private final List<String> alternativeNames;
	private final String type;
	private final Double redshift;
	private final Double distance;
	private final Double inclination;
	private final Double d25;
	private final Double majorAxis;
	private final Double minorAxis;
	private final Double positionAngle;
	
	private GalaxyAttributes(Builder builder) {
		this.name = builder.name;
		this.principal = builder.principal;
		this.parent = builder.parent;
		this.companions = List.copyOf(builder.companions);
		this.alternativeNames = List.copyOf(builder.alternativeNames);
		this.type = builder.type;
		this.redshift = builder.redshift;
		this.distance = builder.distance;
		this.inclination = builder.inclination;
		this.d25 = builder.d25;
		this.majorAxis = builder.majorAxis;
		this.minorAxis = builder.minorAxis;
		this.positionAngle = builder.positionAngle;
	}
	
	/**
	 * Create a builder for a galaxy with the given name.
	 * @param name
	 * @return
	 */
	public static Builder builder(String name) {
		return new Builder(name);
	}

	@SuppressWarnings("javadoc")
	public String getName() {
		return name;
	}

	/**
	 * Query whether this is the principal galaxy of the field.
	 * @return
	 */
	public boolean isPrincipal() {
		return principal;
	}

	/**
	 * Name of the parent galaxy, if this is a companion; otherwise null.
	 * @return
	 */
	public String getParent() {
		return parent;
	}
	
	/**
	 * Query whether this galaxy is a companion of another.
	 * @return
	 */
	public boolean isCompanion() {
		return parent != null;
	}

	@SuppressWarnings("javadoc")
	public List<String> getCompanions() {
		return companions == null ? Collections.emptyList() : companions;
	}

	@SuppressWarnings("javadoc")
	public List<String> getAlternativeNames() {
		return alternativeNames == null ? Collections.emptyList() : alternativeNames;
	}

	@SuppressWarnings("javadoc")
	public String getType() {
		return type;
	}

	@SuppressWarnings("javadoc")
	public Double getRedshift() {
		return redshift;
	}

	/**
	 * Distance, in Mpc.
	 * @return
	 */
	public Double getDistance() {
		return distance;
	}

	/**
	 * Inclination, in degrees.
	 * @return
	 */
	public Double getInclination() {
		return inclination;
	}

	/**
	 * Diameter of the 25 mag/arcsec^2 isophote, in arcminutes.
	 * @return
	 */
	public Double getD25() {
		return d25;
	}

	/**
	 * Major axis diameter, in arcminutes.
	 * @return
	 */
	public Double getMajorAxis() {
		return majorAxis;
	}

	/**
	 * Minor axis diameter, in arcminutes.
	 * @return
	 */
	public Double getMinorAxis() {
		return minorAxis;
	}

	/**
	 * Position angle, in degrees east of north.
	 * @return
	 */
	public Double getPositionAngle() {
		return positionAngle;
	}
	
	/**
	 * Query whether the catalog gives a usable major axis.
	 * @return
	 */
	public boolean hasExtent() {
		return majorAxis != null && majorAxis > 0;
	}
	
	
	/**
	 * Builder for {@link GalaxyAttributes}.
	 */
	public static class Builder {
		
		private final String name;
		private boolean principal;
		private String parent;
		private List<String> companions = List.of();
		private List<String> alternativeNames = List.of();
		private String type;
		private Double redshift;
		private Double distance;
		private Double inclination;
		private Double d25;
		private Double majorAxis;
		private Double minorAxis;
		private Double positionAngle;
		
		private Builder(String name) {
			this.name = name;
		}
		
		@SuppressWarnings("javadoc")
		public Builder principal(boolean principal) {
			this.principal = principal;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder parent(String parent) {
			this.parent = parent;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder companions(List<String> companions) {
			this.companions = companions;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder alternativeNames(List<String> names) {
			this.alternativeNames = names;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder type(String type) {
			this.type = type;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder redshift(Double redshift) {
			this.redshift = redshift;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder distance(Double distance) {
			this.distance = distance;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder inclination(Double inclination) {
			this.inclination = inclination;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public Builder d25(Double d25) {
			this.d25 = d25;
			return this;
		}
		
		/**
		 * Set the shape of the galaxy.
		 * @param majorAxis major axis diameter, in arcminutes
		 * @param minorAxis minor axis diameter, in arcminutes
		 * @param positionAngle in degrees east of north
		 * @return
		 */
		public Builder shape(Double majorAxis, Double minorAxis, Double positionAngle) {
			this.majorAxis = majorAxis;
			this.minorAxis = minorAxis;
			this.positionAngle = positionAngle;
			return this;
		}
		
		@SuppressWarnings("javadoc")
		public GalaxyAttributes build() {
			return new GalaxyAttributes(this);
		}
		
	}

}
