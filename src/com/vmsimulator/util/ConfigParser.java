package com.vmsimulator.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ConfigParser
 *
 * Utilidades para leer secuencias de referencias desde texto o ficheros.
 *
 * Formato: números de página no negativos separados por comas y/o espacios.
 * Ejemplo: 1,2,3,4,1,2,5,1,2,3,4,5
 *
 * En ficheros se ignoran líneas vacías y comentarios que empiezan por '#';
 * las líneas restantes se concatenan en una única secuencia.
 */
public final class ConfigParser {

    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    private ConfigParser() {
    }

    /**
     * Parsea una secuencia escrita por el usuario.
     *
     * @param text texto con páginas separadas por comas o espacios
     * @return lista de páginas (vacía si el texto está en blanco)
     * @throws IllegalArgumentException si algún token no es un entero no
     *                                  negativo
     */
    public static List<Integer> parseSequence(String text) {
        List<Integer> pages = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return pages;
        }

        for (String token : SEPARATOR.split(text.trim())) {
            if (token.isEmpty()) {
                continue;
            }
            pages.add(parsePage(token));
        }
        return pages;
    }

    /**
     * Parsea una secuencia desde un fichero de texto UTF-8.
     *
     * @param filename ruta del fichero a leer
     * @return lista de páginas en orden de aparición
     * @throws IOException si ocurre un error de I/O o de formato
     */
    public static List<Integer> parseSequenceFromFile(String filename) throws IOException {
        List<Integer> pages = new ArrayList<>();
        Path p = Path.of(filename);

        try (BufferedReader reader = Files.newBufferedReader(p, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                try {
                    pages.addAll(parseSequence(line));
                } catch (IllegalArgumentException e) {
                    throw new IOException(filename + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }

        return pages;
    }

    /**
     * Parsea un número de página.
     *
     * @param token texto del token
     * @return página no negativa
     */
    private static int parsePage(String token) {
        int page;
        try {
            page = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page reference: '" + token + "'", e);
        }
        if (page < 0) {
            throw new IllegalArgumentException("Invalid page reference: '" + token + "' (must be >= 0)");
        }
        return page;
    }
}
