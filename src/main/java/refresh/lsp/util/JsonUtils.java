/*
 * Copyright 2024-2025, Seqera Labs
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package refresh.lsp.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Lookup of dotted paths (e.g. "refreshLatch.delayTime") in the
 * settings object sent by the client.
 *
 * Missing or mistyped values are returned as null so that callers
 * can fall back to their current value.
 *
 * @author refresh-latch developers
 */
public class JsonUtils {

    public static Boolean getBoolean(Object json, String path) {
        var value = getPrimitive(json, path);
        if( value == null || !value.getAsJsonPrimitive().isBoolean() )
            return null;
        return value.getAsBoolean();
    }

    public static Long getLong(Object json, String path) {
        var value = getPrimitive(json, path);
        if( value == null )
            return null;
        try {
            return value.getAsLong();
        }
        catch( NumberFormatException e ) {
            return null;
        }
    }

    private static JsonElement getPrimitive(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonPrimitive() )
            return null;
        return value;
    }

    private static JsonElement getObjectPath(Object json, String path) {
        if( !(json instanceof JsonObject) )
            return null;

        JsonObject object = (JsonObject) json;
        var names = path.split("\\.");
        for( int i = 0; i < names.length - 1; i++ ) {
            var scope = names[i];
            if( !object.has(scope) || !object.get(scope).isJsonObject() )
                return null;
            object = object.get(scope).getAsJsonObject();
        }

        var property = names[names.length - 1];
        if( !object.has(property) )
            return null;
        return object.get(property);
    }

}
