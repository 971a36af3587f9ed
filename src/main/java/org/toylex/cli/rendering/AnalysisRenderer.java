package org.toylex.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.toylex.analyzer.api.AnalysisResult;
import org.toylex.analyzer.pif.PifEntry;

import java.io.PrintWriter;
import java.util.List;

/**
 * Writes analysis results as text or JSON.
 * <p>
 * The text form lists the symbol table with its indices, then one {@code (code, index)} line per
 * PIF entry. The JSON form holds the same data; several results are written as an array.
 */
public class AnalysisRenderer {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * Renders the given results.
     * @param results The results to write, in order.
     * @param format The output format.
     * @param out The target writer; flushed when done.
     */
    public void render(List<AnalysisResult> results, OutputFormat format, PrintWriter out) {
        switch (format) {
            case TEXT -> results.forEach(result -> renderText(result, out));
            case JSON -> {
                JsonElement json;
                if (results.size() == 1) {
                    json = toJson(results.get(0));
                } else {
                    JsonArray array = new JsonArray();
                    results.forEach(result -> array.add(toJson(result)));
                    json = array;
                }
                out.println(gson.toJson(json));
            }
        }
        out.flush();
    }

    private void renderText(AnalysisResult result, PrintWriter out) {
        out.println("== " + result.sourceName());
        out.println("Symbol table:");
        List<String> symbols = result.symbolTableEntries();
        for (int i = 0; i < symbols.size(); i++) {
            out.println(i + " " + symbols.get(i));
        }
        out.println();
        out.println("PIF:");
        for (PifEntry entry : result.pif()) {
            out.println(entry);
        }
    }

    /**
     * Converts a result into its JSON form.
     * @param result The analysis result.
     * @return An object with {@code source}, {@code symbolTable} and {@code pif} members.
     */
    public JsonObject toJson(AnalysisResult result) {
        JsonObject object = new JsonObject();
        object.addProperty("source", result.sourceName());

        JsonArray symbols = new JsonArray();
        result.symbolTableEntries().forEach(symbols::add);
        object.add("symbolTable", symbols);

        JsonArray pif = new JsonArray();
        for (PifEntry entry : result.pif()) {
            JsonObject item = new JsonObject();
            item.addProperty("kind", entry.kind().name());
            item.addProperty("code", entry.code());
            item.addProperty("index", entry.index());
            pif.add(item);
        }
        object.add("pif", pif);
        return object;
    }
}
