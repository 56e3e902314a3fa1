package de.t14d3.bobbin.test.entities;

import de.t14d3.bobbin.annotations.Table;
import de.t14d3.bobbin.model.Model;

/**
 * Keyed by its ISO code and stored without timestamps.
 */
@Table(name = "countries", primaryKey = "code", timestamps = false)
public class Country extends Model {
}
