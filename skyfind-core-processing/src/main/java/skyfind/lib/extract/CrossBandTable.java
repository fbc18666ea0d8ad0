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

package skyfind.lib.extract;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import skyfind.lib.geom.SkyCoordinate;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;

/**
 * One row per catalog object, combining the fluxes measured in every band.
 * <p>
 * A band only has a flux for a row if the object was detected in that band's frame and the flux is finite.
 * 
 * @author SkyFind developers
 */
public class CrossBandTable implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	/**
	 * A row of the table.
	 * 
	 * @param index catalog index
	 * @param id external identifier, or null
	 * @param name galaxy name, or null for stars
	 * @param position catalog position
	 * @param fluxes flux per band, only for bands where the object was detected
	 */
	public record Row(int index, String id, String name, SkyCoordinate position, Map<String, Double> fluxes) implements Serializable {
		
		/**
		 * Get the flux in a band.
		 * @param band
		 * @return the flux, or NaN if the object was not detected in the band
		 */
		public double getFlux(String band) {
			var flux = fluxes.get(band);
			return flux == null ? Double.NaN : flux;
		}
		
	}
	
	private final ObjectKind kind;
	private final List<String> bands;
	private final List<Row> rows;
	
	private CrossBandTable(ObjectKind kind, List<String> bands, List<Row> rows) {
		this.kind = kind;
		this.bands = List.copyOf(bands);
		this.rows = Collections.unmodifiableList(rows);
	}
	
	/**
	 * Merge per-frame results into a table with one row per catalog object.
	 * 
	 * @param catalog
	 * @param results completed results keyed by band (frame) name; iteration order gives the column order
	 * @return
	 */
	public static CrossBandTable merge(ObjectCatalog catalog, Map<String, ExtractionResult> results) {
		Map<String, Map<Integer, DetectionRow>> byBand = new LinkedHashMap<>();
		for (var entry : results.entrySet()) {
			Map<Integer, DetectionRow> map = new HashMap<>();
			for (var row : entry.getValue().getRows())
				map.put(row.index(), row);
			byBand.put(entry.getKey(), map);
		}
		var rows = new ArrayList<Row>();
		for (var object : catalog.getObjects()) {
			Map<String, Double> fluxes = new LinkedHashMap<>();
			for (var entry : byBand.entrySet()) {
				var row = entry.getValue().get(object.getIndex());
				if (row != null && row.hasDetectedFlux())
					fluxes.put(entry.getKey(), row.flux());
			}
			String name = object.getGalaxy() == null ? null : object.getGalaxy().getName();
			rows.add(new Row(object.getIndex(), object.getId(), name, object.getPosition(), Collections.unmodifiableMap(fluxes)));
		}
		return new CrossBandTable(catalog.getKind(), new ArrayList<>(results.keySet()), rows);
	}
	
	/**
	 * Create a new table containing only the rows accepted by a predicate.
	 * @param predicate
	 * @return
	 */
	public CrossBandTable filter(Predicate<Row> predicate) {
		return new CrossBandTable(kind, bands, new ArrayList<>(rows.stream().filter(predicate).toList()));
	}
	
	public ObjectKind getKind() {
		return kind;
	}
	
	/**
	 * Band names, in column order.
	 * @return
	 */
	public List<String> getBands() {
		return bands;
	}
	
	public List<Row> getRows() {
		return rows;
	}
	
	/**
	 * Get the row for a catalog index.
	 * @param index
	 * @return
	 */
	public Optional<Row> getRow(int index) {
		return rows.stream().filter(r -> r.index() == index).findFirst();
	}
	
	public int size() {
		return rows.size();
	}
	
	/**
	 * Column names for writing the table.
	 * @return
	 */
	public List<String> getHeader() {
		var header = new ArrayList<String>(List.of("index", "id", "name", "ra", "dec"));
		for (var band : bands)
			header.add(band + " flux");
		return header;
	}
	
	/**
	 * Row values for writing the table, matching {@link #getHeader()}.
	 * @return
	 */
	public List<List<Object>> toTableRows() {
		var list = new ArrayList<List<Object>>();
		for (var row : rows) {
			var values = new ArrayList<Object>();
			values.add(row.index());
			values.add(row.id());
			values.add(row.name());
			values.add(row.position() == null ? null : row.position().getRA());
			values.add(row.position() == null ? null : row.position().getDec());
			for (var band : bands)
				values.add(row.fluxes().get(band));
			list.add(values);
		}
		return list;
	}

}
