package de.bsommerfeld.patchfetcher.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Support account used to authenticate against the catalog service.
 * The password may be omitted from the file and supplied on the command line.
 */
public class CredentialsConfig {

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    public CredentialsConfig() {
    }

    public CredentialsConfig(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    @Override
    public String toString() {
        // Never print the password
        return "CredentialsConfig[username=" + username + "]";
    }
}
