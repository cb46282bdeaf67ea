/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.syndication.listingfeed.shared;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the feed's abbreviation codes to human-readable labels.
 * Characteristic categories and characteristic values have separate tables;
 * a code that is not mapped is returned unchanged.
 */
public final class CodeTables {

    private static final Map<String, String> CATEGORY_LABELS = buildCategoryLabels();
    private static final Map<String, String> VALUE_LABELS = buildValueLabels();

    private CodeTables() { }

    /**
     * Returns the label of a characteristic category code, or the code itself when unknown.
     */
    public static String categoryLabel(String code) {
        if (code == null) {
            return null;
        }
        return CATEGORY_LABELS.getOrDefault(code, code);
    }

    /**
     * Returns the label of a characteristic value code, or the code itself when unknown.
     */
    public static String valueLabel(String code) {
        if (code == null) {
            return null;
        }
        return VALUE_LABELS.getOrDefault(code, code);
    }

    public static Map<String, String> categoryLabels() {
        return CATEGORY_LABELS;
    }

    public static Map<String, String> valueLabels() {
        return VALUE_LABELS;
    }

    private static Map<String, String> buildCategoryLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("ALLE", "Allée");
        labels.put("CHAU", "Mode de chauffage");
        labels.put("EAU", "Approvisionnement en eau");
        labels.put("ENER", "Énergie pour chauffage");
        labels.put("FENE", "Fenestration");
        labels.put("FOND", "Fondation");
        labels.put("PARE", "Revêtement extérieur");
        labels.put("SS", "Sous-sol");
        labels.put("SYEG", "Système d'égout");
        labels.put("TFEN", "Type de fenestration");
        labels.put("VUE", "Vue");
        labels.put("ZONG", "Zonage");
        labels.put(FeedLayout.Characteristics.PROXIMITY_CATEGORY, "Proximité");
        return Collections.unmodifiableMap(labels);
    }

    private static Map<String, String> buildValueLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        // ALLE
        labels.put("NPAV", "Non pavé");
        // CHAU
        labels.put("PELC", "Plinthes électriques");
        // EAU
        labels.put("AMU", "Municipal");
        // ENER
        labels.put("ELEC", "Électricité");
        // FENE
        labels.put("BOIS", "BOIS");
        labels.put("PVC", "PVC");
        // FOND
        labels.put("BETO", "Béton");
        // PARE
        labels.put("AU", "Autre");
        // SS
        labels.put("VSAN", "Vide sanitaire");
        // SYEG
        labels.put("EGMU", "Égout municipal");
        // TFEN
        labels.put("COUL", "COUL");
        labels.put("PFEN", "PFEN");
        // VUE
        labels.put("EAU", "Vue sur l'eau");
        // ZONG
        labels.put("RES", "Résidentiel");
        // PROX
        labels.put("AUTO", "Autoroute");
        labels.put("PCYC", "Piste cyclable");
        labels.put("PRIM", "École primaire");
        labels.put("SEC", "École secondaire");
        labels.put("TRSP", "Transport en commun");
        return Collections.unmodifiableMap(labels);
    }
}
