package com.kinoscope.metadata.resolve.merge;

import java.util.List;

/**
 * Maps free-text country names to ISO 3166 alpha-2 codes (or the retired codes of historical states).
 */
public interface CountryCodeMapper {
    List<String> toIsoCodes(List<String> countryNames);
}
