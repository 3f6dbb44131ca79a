package com.kinoscope.metadata.resolve.merge;

import com.kinoscope.metadata.resolve.util.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Country names as the regional database writes them (Czech, sometimes English, including historical
 * states). Lookup keys are diacritic-free, so "Česko" and "Cesko" agree.
 */
@Component
public class CzechCountryCodeMapper implements CountryCodeMapper {
    private static final Logger log = LoggerFactory.getLogger(CzechCountryCodeMapper.class);
    private static final Pattern ISO_CODE = Pattern.compile("[A-Za-z]{2}");
    private static final Map<String, String> CODES = buildTable();

    @Override
    public List<String> toIsoCodes(List<String> countryNames) {
        if (countryNames == null || countryNames.isEmpty()) {
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        for (String name : countryNames) {
            String code = toIsoCode(name);
            if (code != null) {
                codes.add(code);
            }
        }
        return new ArrayList<>(codes);
    }

    String toIsoCode(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        String code = CODES.get(TitleNormalizer.normalizeTitle(trimmed));
        if (code != null) {
            return code;
        }
        if (ISO_CODE.matcher(trimmed).matches()) {
            return trimmed.toUpperCase(Locale.ROOT);
        }
        log.debug("No country code for '{}'", trimmed);
        return null;
    }

    private static Map<String, String> buildTable() {
        Map<String, String> table = new HashMap<>();
        // Historical states
        put(table, "CS", "Československo", "Czechoslovakia");
        put(table, "AH", "Rakousko-Uhersko", "Austria-Hungary", "Austria Hungary");
        put(table, "SU", "SSSR", "Sovětský svaz", "Soviet Union", "USSR");
        put(table, "DE", "Německé císařství", "German Empire", "Německo", "Germany", "Západní Německo", "West Germany");
        put(table, "XR", "Německá říše", "Third Reich", "German Reich");
        put(table, "XM", "Protektorát Čechy a Morava", "Protectorate of Bohemia and Moravia", "Bohemia and Moravia");
        put(table, "YU", "Jugoslávie", "Yugoslavia");
        put(table, "DD", "Východní Německo", "NDR", "East Germany");
        // Present-day states
        put(table, "CZ", "Česko", "Česká republika", "Czechia", "Czech Republic");
        put(table, "SK", "Slovensko", "Slovakia");
        put(table, "US", "USA", "Spojené státy", "Spojené státy americké", "United States", "United States of America");
        put(table, "GB", "Velká Británie", "Spojené království", "United Kingdom", "UK", "Anglie", "England");
        put(table, "IE", "Irsko", "Ireland");
        put(table, "FR", "Francie", "France");
        put(table, "IT", "Itálie", "Italy");
        put(table, "ES", "Španělsko", "Spain");
        put(table, "PT", "Portugalsko", "Portugal");
        put(table, "AT", "Rakousko", "Austria");
        put(table, "CH", "Švýcarsko", "Switzerland");
        put(table, "BE", "Belgie", "Belgium");
        put(table, "NL", "Nizozemsko", "Holandsko", "Netherlands");
        put(table, "LU", "Lucembursko", "Luxembourg");
        put(table, "DK", "Dánsko", "Denmark");
        put(table, "SE", "Švédsko", "Sweden");
        put(table, "NO", "Norsko", "Norway");
        put(table, "FI", "Finsko", "Finland");
        put(table, "IS", "Island", "Iceland");
        put(table, "PL", "Polsko", "Poland");
        put(table, "HU", "Maďarsko", "Hungary");
        put(table, "RO", "Rumunsko", "Romania");
        put(table, "BG", "Bulharsko", "Bulgaria");
        put(table, "GR", "Řecko", "Greece");
        put(table, "TR", "Turecko", "Turkey");
        put(table, "RU", "Rusko", "Russia");
        put(table, "UA", "Ukrajina", "Ukraine");
        put(table, "BY", "Bělorusko", "Belarus");
        put(table, "LT", "Litva", "Lithuania");
        put(table, "LV", "Lotyšsko", "Latvia");
        put(table, "EE", "Estonsko", "Estonia");
        put(table, "SI", "Slovinsko", "Slovenia");
        put(table, "HR", "Chorvatsko", "Croatia");
        put(table, "RS", "Srbsko", "Serbia");
        put(table, "BA", "Bosna a Hercegovina", "Bosnia and Herzegovina");
        put(table, "ME", "Černá Hora", "Montenegro");
        put(table, "MK", "Severní Makedonie", "Makedonie", "North Macedonia");
        put(table, "AL", "Albánie", "Albania");
        put(table, "GE", "Gruzie", "Georgia");
        put(table, "AM", "Arménie", "Armenia");
        put(table, "AZ", "Ázerbájdžán", "Azerbaijan");
        put(table, "KZ", "Kazachstán", "Kazakhstan");
        put(table, "IL", "Izrael", "Israel");
        put(table, "PS", "Palestina", "Palestine");
        put(table, "LB", "Libanon", "Lebanon");
        put(table, "JO", "Jordánsko", "Jordan");
        put(table, "SA", "Saúdská Arábie", "Saudi Arabia");
        put(table, "AE", "Spojené arabské emiráty", "United Arab Emirates");
        put(table, "QA", "Katar", "Qatar");
        put(table, "IR", "Írán", "Iran");
        put(table, "IQ", "Irák", "Iraq");
        put(table, "AF", "Afghánistán", "Afghanistan");
        put(table, "IN", "Indie", "India");
        put(table, "PK", "Pákistán", "Pakistan");
        put(table, "BD", "Bangladéš", "Bangladesh");
        put(table, "NP", "Nepál", "Nepal");
        put(table, "LK", "Srí Lanka", "Sri Lanka");
        put(table, "CN", "Čína", "China");
        put(table, "HK", "Hongkong", "Hong Kong");
        put(table, "TW", "Tchaj-wan", "Taiwan");
        put(table, "JP", "Japonsko", "Japan");
        put(table, "KR", "Jižní Korea", "South Korea", "Korea");
        put(table, "KP", "Severní Korea", "North Korea");
        put(table, "MN", "Mongolsko", "Mongolia");
        put(table, "VN", "Vietnam");
        put(table, "TH", "Thajsko", "Thailand");
        put(table, "KH", "Kambodža", "Cambodia");
        put(table, "MY", "Malajsie", "Malaysia");
        put(table, "SG", "Singapur", "Singapore");
        put(table, "ID", "Indonésie", "Indonesia");
        put(table, "PH", "Filipíny", "Philippines");
        put(table, "AU", "Austrálie", "Australia");
        put(table, "NZ", "Nový Zéland", "New Zealand");
        put(table, "CA", "Kanada", "Canada");
        put(table, "MX", "Mexiko", "Mexico");
        put(table, "CU", "Kuba", "Cuba");
        put(table, "BR", "Brazílie", "Brazil");
        put(table, "AR", "Argentina");
        put(table, "CL", "Chile");
        put(table, "CO", "Kolumbie", "Colombia");
        put(table, "PE", "Peru");
        put(table, "VE", "Venezuela");
        put(table, "UY", "Uruguay");
        put(table, "EG", "Egypt");
        put(table, "MA", "Maroko", "Morocco");
        put(table, "TN", "Tunisko", "Tunisia");
        put(table, "DZ", "Alžírsko", "Algeria");
        put(table, "NG", "Nigérie", "Nigeria");
        put(table, "SN", "Senegal");
        put(table, "KE", "Keňa", "Kenya");
        put(table, "UG", "Uganda");
        put(table, "ET", "Etiopie", "Ethiopia");
        put(table, "ZA", "Jihoafrická republika", "JAR", "South Africa");
        return table;
    }

    private static void put(Map<String, String> table, String code, String... names) {
        for (String name : names) {
            table.put(TitleNormalizer.normalizeTitle(name), code);
        }
    }
}
