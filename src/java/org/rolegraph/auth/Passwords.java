/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.rolegraph.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

/**
 * Credential hashing for role passwords. Verifying a login belongs to the authenticator; the
 * engine only guarantees a clear-text password is never stored.
 */
public final class Passwords
{
    private static final String SCHEME = "sha256";
    private static final String SEPARATOR = "$";
    private static final int SALT_BYTES = 16;
    private static final SecureRandom random = new SecureRandom();

    private Passwords()
    {
    }

    /**
     * Hashes a clear-text password with a random salt. A value which is already a hash in a
     * recognized format is returned unchanged.
     */
    public static String hash(String password)
    {
        if (isHashed(password))
            return password;

        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        String encodedSalt = BaseEncoding.base16().lowerCase().encode(salt);
        return SCHEME + SEPARATOR + encodedSalt + SEPARATOR + digest(encodedSalt, password);
    }

    public static boolean matches(String hash, String candidate)
    {
        if (hash == null || candidate == null || !hash.startsWith(SCHEME + SEPARATOR))
            return false;

        String[] parts = hash.split("\\" + SEPARATOR);
        return parts.length == 3 && MessageDigest.isEqual(parts[2].getBytes(StandardCharsets.UTF_8),
                                                  digest(parts[1], candidate).getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isHashed(String password)
    {
        return password.startsWith(SCHEME + SEPARATOR) || password.startsWith("SCRAM-SHA-256$");
    }

    private static String digest(String salt, String password)
    {
        return Hashing.sha256().hashString(salt + password, StandardCharsets.UTF_8).toString();
    }
}
